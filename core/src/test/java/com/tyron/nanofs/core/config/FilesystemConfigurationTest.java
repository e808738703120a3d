package com.tyron.nanofs.core.config;

import com.tyron.nanofs.api.vfs.PathConventions;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public class FilesystemConfigurationTest {

    private static FilesystemConfiguration load(String resource) throws Exception {
        try (InputStream in = FilesystemConfigurationTest.class.getResourceAsStream(resource)) {
            Assertions.assertNotNull(in, resource);
            return FilesystemConfiguration.load(in);
        }
    }

    private static FilesystemConfiguration parse(String yaml) {
        return FilesystemConfiguration.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void defaults() {
        FilesystemConfiguration config = FilesystemConfiguration.defaults();
        Assertions.assertEquals(PathConventions.POSIX, config.getConventions());
        Assertions.assertTrue(config.isFollowLinks());
        Assertions.assertEquals(FilesystemConfiguration.DEFAULT_MAX_LINK_HOPS, config.getMaxLinkHops());
        Assertions.assertEquals(FilesystemConfiguration.DEFAULT_BUFFER_SIZE, config.getBufferSize());
    }

    @Test
    public void emptyDocumentKeepsDefaults() {
        FilesystemConfiguration config = parse("");
        Assertions.assertEquals(FilesystemConfiguration.defaults().getConventions(), config.getConventions());
        Assertions.assertEquals(FilesystemConfiguration.DEFAULT_BUFFER_SIZE, config.getBufferSize());
    }

    @Test
    public void windowsPreset() throws Exception {
        FilesystemConfiguration config = load("/config/windows.yaml");
        Assertions.assertEquals(PathConventions.WINDOWS, config.getConventions());
        Assertions.assertFalse(config.isFollowLinks());
        Assertions.assertEquals(8, config.getMaxLinkHops());
        Assertions.assertEquals(4096, config.getBufferSize());
    }

    @Test
    public void urlConventionsFromAMapping() throws Exception {
        FilesystemConfiguration config = load("/config/url.yaml");
        PathConventions conventions = config.getConventions();

        Assertions.assertEquals("mem", conventions.getScheme());
        Assertions.assertEquals("scratch", conventions.getAuthority());
        Assertions.assertEquals('_', conventions.getHiddenMarker());
        Assertions.assertEquals("mem://scratch/", conventions.getDefaultRoot());
        Assertions.assertEquals(1024, config.getBufferSize());
        Assertions.assertTrue(config.isFollowLinks());
    }

    @Test
    public void urlConventionsFromAString() {
        FilesystemConfiguration config = parse("conventions: \"ftp://mirror/\"\nhiddenMarker: \"~\"\n");
        Assertions.assertEquals("ftp://mirror/", config.getConventions().getDefaultRoot());
        Assertions.assertEquals('~', config.getConventions().getHiddenMarker());
    }

    @Test
    public void invalidValuesAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> load("/config/invalid-buffer.yaml"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> parse("conventions: amiga"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> parse("maxLinkHops: 0"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> parse("hiddenMarker: \"..\""));
        Assertions.assertThrows(IllegalArgumentException.class, () -> parse("- just\n- a list\n"));
    }

    @Test
    public void fromMapMatchesYaml() {
        FilesystemConfiguration config = FilesystemConfiguration.fromMap(Map.of("conventions", "unix", "followLinks", false));
        Assertions.assertEquals(PathConventions.POSIX, config.getConventions());
        Assertions.assertFalse(config.isFollowLinks());
    }
}
