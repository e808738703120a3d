package com.tyron.nanofs.core.vfs;

import com.tyron.nanofs.api.vfs.InvalidPathnameException;
import com.tyron.nanofs.api.vfs.Node;
import com.tyron.nanofs.api.vfs.PathConventions;
import com.tyron.nanofs.core.config.FilesystemConfiguration;
import com.tyron.nanofs.core.test.MemoryAdapter;
import com.tyron.nanofs.core.test.TestLogging;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

public class FilesystemRegistryTest {

    private FilesystemRegistry registry;
    private AdapterFilesystem local;
    private AdapterFilesystem scratch;

    @BeforeEach
    public void setUp() throws Exception {
        TestLogging.configureOnce();

        registry = new FilesystemRegistry();

        local = new AdapterFilesystem(new MemoryAdapter().file("/etc/hosts", "127.0.0.1 localhost"));

        PathConventions mem = PathConventions.url("mem", "scratch");
        scratch = new AdapterFilesystem(new MemoryAdapter(mem).file("/notes/todo.txt", "milk"),
                FilesystemConfiguration.defaults(mem));

        registry.register("file", local);
        registry.register(scratch);
        registry.setDefaultScheme("file");
    }

    @AfterEach
    public void tearDown() {
        registry.closeAll();
    }

    @Test
    public void routesBySchemePrefix() throws Exception {
        Node todo = registry.find("mem://scratch/notes/todo.txt");
        Assertions.assertSame(scratch, todo.getFilesystem());
        Assertions.assertEquals("mem://scratch/notes/todo.txt", todo.getPathname().toString());
        Assertions.assertEquals("milk", todo.readText());

        Assertions.assertSame(scratch, registry.find("MEM://scratch/notes").getFilesystem());
    }

    @Test
    public void plainPathsGoToTheDefaultScheme() throws Exception {
        Node hosts = registry.find("/etc/hosts");
        Assertions.assertSame(local, hosts.getFilesystem());
        Assertions.assertTrue(hosts.isFile());
    }

    @Test
    public void schemeIsStrippedForPlainFilesystems() throws Exception {
        Node hosts = registry.find("file:///etc/hosts");
        Assertions.assertSame(local, hosts.getFilesystem());
        Assertions.assertEquals("/etc/hosts", hosts.getPathname().toString());
        Assertions.assertEquals("/", registry.find("file://host").getPathname().toString());
    }

    @Test
    public void driveLetterSurvivesSchemeStripping() throws Exception {
        AdapterFilesystem windows = new AdapterFilesystem(
                new MemoryAdapter(PathConventions.WINDOWS).file("C:/x/readme.txt", "hi"),
                FilesystemConfiguration.defaults(PathConventions.WINDOWS));
        registry.register("win", windows);

        Node x = registry.find("win:///C:/x");
        Assertions.assertEquals("C:/x", x.getPathname().toString());
        Assertions.assertTrue(x.isDirectory());
        Assertions.assertEquals("hi", registry.find("win:///c:/x/readme.txt").readText());
        Assertions.assertEquals("C:/", registry.find("win:///C:").getPathname().toString());
    }

    @Test
    public void unknownSchemeIsAnInvalidPath() {
        InvalidPathnameException e = Assertions.assertThrows(InvalidPathnameException.class,
                () -> registry.find("ftp://mirror/pub"));
        Assertions.assertEquals("ftp://mirror/pub", e.getInput());

        registry.unregister("file");
        Assertions.assertNull(registry.getDefaultScheme());
        Assertions.assertThrows(InvalidPathnameException.class, () -> registry.find("/etc/hosts"));
    }

    @Test
    public void foreignAuthorityIsRejectedByTheFilesystem() {
        Assertions.assertThrows(InvalidPathnameException.class, () -> registry.find("mem://elsewhere/notes"));
    }

    @Test
    public void registration() {
        Assertions.assertEquals(Set.of("file", "mem"), registry.getRegisteredSchemes());
        Assertions.assertSame(scratch, registry.getFilesystem("MEM"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.register(local));
    }

    @Test
    public void closeAllClosesEveryFilesystem() {
        registry.closeAll();
        Assertions.assertTrue(local.isClosed());
        Assertions.assertTrue(scratch.isClosed());
        Assertions.assertTrue(registry.getRegisteredSchemes().isEmpty());
    }
}
