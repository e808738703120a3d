package com.tyron.nanofs.core.vfs;

import com.tyron.nanofs.api.vfs.InvalidPathnameException;
import com.tyron.nanofs.api.vfs.ListFilter;
import com.tyron.nanofs.api.vfs.Node;
import com.tyron.nanofs.api.vfs.NodeNotFoundException;
import com.tyron.nanofs.api.vfs.PathConventions;
import com.tyron.nanofs.core.config.FilesystemConfiguration;
import com.tyron.nanofs.core.test.MemoryAdapter;
import com.tyron.nanofs.core.test.TestLogging;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

public class AdapterFilesystemTest {

    @BeforeEach
    public void setUp() {
        TestLogging.configureOnce();
    }

    @Test
    public void windowsDrivesAreSeparateRoots() throws Exception {
        MemoryAdapter adapter = new MemoryAdapter(PathConventions.WINDOWS)
                .file("c:\\Users\\me\\notes.txt", "c")
                .file("D:/backup/notes.txt", "d");

        try (AdapterFilesystem fs = new AdapterFilesystem(adapter, FilesystemConfiguration.defaults(PathConventions.WINDOWS))) {
            Node c = fs.getNode("C:\\Users\\me\\notes.txt");
            Assertions.assertEquals("C:/Users/me/notes.txt", c.getPathname().toString());
            Assertions.assertEquals("c", c.readText());
            Assertions.assertEquals("d", fs.getNode("d:\\backup\\notes.txt").readText());

            Assertions.assertEquals(List.of("C:/Users/me", "C:/Users/me/notes.txt"),
                    names(fs.getNode("C:/Users").ls(ListFilter.recursive())));
            Assertions.assertEquals(URI.create("memory:/D:/backup/notes.txt"), fs.getNode("D:/backup/notes.txt").toUri());
        }
    }

    @Test
    public void unknownDriveDoesNotExistUntilCreated() throws Exception {
        MemoryAdapter adapter = new MemoryAdapter(PathConventions.WINDOWS);

        try (AdapterFilesystem fs = new AdapterFilesystem(adapter, FilesystemConfiguration.defaults(PathConventions.WINDOWS))) {
            Node z = fs.getNode("Z:/");
            Assertions.assertFalse(z.exists());
            Assertions.assertFalse(z.exists());
            Assertions.assertFalse(fs.getNode("Z:/tmp").exists());
            Assertions.assertThrows(NodeNotFoundException.class, () -> fs.getNode("Z:/tmp/a.txt").write("a"));

            fs.getNode("Z:/tmp").createDirectory(true);
            Assertions.assertTrue(z.isDirectory());
            Assertions.assertEquals(List.of("Z:/tmp"), names(z.getChildren()));
        }
    }

    @Test
    public void urlConventions() throws Exception {
        PathConventions mem = PathConventions.url("mem", "scratch");
        MemoryAdapter adapter = new MemoryAdapter(mem).file("/a/b.txt", "b");

        try (AdapterFilesystem fs = new AdapterFilesystem(adapter, FilesystemConfiguration.defaults(mem))) {
            Node b = fs.getNode("mem://scratch/a/./b.txt");
            Assertions.assertEquals("mem://scratch/a/b.txt", b.getPathname().toString());
            Assertions.assertEquals(b, fs.getNode("/a/b.txt"));
            Assertions.assertEquals("mem://scratch/", fs.getRoot().getPathname().toString());
            Assertions.assertEquals(URI.create("mem://scratch/a/b.txt"), b.toUri());
            Assertions.assertThrows(InvalidPathnameException.class, () -> fs.getNode("ftp://scratch/a"));
        }
    }

    @Test
    public void configuredHiddenMarker() throws Exception {
        PathConventions underscore = PathConventions.POSIX.withHiddenMarker('_');
        MemoryAdapter adapter = new MemoryAdapter(underscore)
                .file("/p/_draft.md", "x")
                .file("/p/.profile", "y");

        try (AdapterFilesystem fs = new AdapterFilesystem(adapter, FilesystemConfiguration.defaults(underscore))) {
            Assertions.assertEquals(List.of("/p/.profile"), names(fs.getNode("/p").ls(ListFilter.visible())));
        }
    }

    @Test
    public void parseRejectsEscapingTheRoot() {
        try (AdapterFilesystem fs = new AdapterFilesystem(new MemoryAdapter())) {
            Assertions.assertThrows(InvalidPathnameException.class, () -> fs.parse("/../etc"));
            Assertions.assertFalse(fs.isClosed());
        }
    }

    private static List<String> names(List<Node> nodes) {
        List<String> out = new ArrayList<>();
        for (Node node : nodes) {
            out.add(node.getPathname().toString());
        }
        return out;
    }
}
