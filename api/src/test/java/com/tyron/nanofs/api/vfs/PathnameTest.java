package com.tyron.nanofs.api.vfs;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class PathnameTest {

    private static final PathConventions POSIX = PathConventions.POSIX;

    @Test
    public void spellingsOfTheSameLocationAreEqual() throws Exception {
        Pathname expected = Pathname.normalize("/a/b", POSIX);

        for (String raw : List.of("/a/b", "/a/b/", "//a//b", "/a/./b", "/a/c/../b", "a/b", "/a/b/.")) {
            Pathname p = Pathname.normalize(raw, POSIX);
            Assertions.assertEquals(expected, p, raw);
            Assertions.assertEquals(expected.hashCode(), p.hashCode(), raw);
            Assertions.assertEquals("/a/b", p.toString(), raw);
        }
    }

    @Test
    public void emptyStringIsTheRoot() throws Exception {
        Pathname root = Pathname.normalize("", POSIX);
        Assertions.assertTrue(root.isRoot());
        Assertions.assertEquals("/", root.toString());
        Assertions.assertNull(root.getParent());
        Assertions.assertEquals("", root.getBasename());
        Assertions.assertEquals(Pathname.root(POSIX), root);
    }

    @Test
    public void climbingAboveTheRootIsInvalid() {
        InvalidPathnameException e = Assertions.assertThrows(InvalidPathnameException.class,
                () -> Pathname.normalize("/a/../..", POSIX));
        Assertions.assertEquals(FilesystemException.Kind.INVALID_PATH, e.getKind());
        Assertions.assertEquals("/a/../..", e.getInput());

        Assertions.assertThrows(InvalidPathnameException.class, () -> Pathname.normalize("..", POSIX));
        Assertions.assertThrows(InvalidPathnameException.class,
                () -> Pathname.normalize("/a", POSIX).join("../../b"));
    }

    @Test
    public void nulCharacterIsInvalid() {
        InvalidPathnameException e = Assertions.assertThrows(InvalidPathnameException.class,
                () -> Pathname.normalize("/a/b\0c", POSIX));
        Assertions.assertTrue(e.getMessage().contains("NUL"), e.getMessage());
    }

    @Test
    public void joinThenParentComesBack() throws Exception {
        Pathname base = Pathname.normalize("/docs/guide", POSIX);
        Pathname child = base.join("intro.md");

        Assertions.assertEquals("/docs/guide/intro.md", child.toString());
        Assertions.assertEquals(base, child.getParent());
        Assertions.assertEquals(base.getDepth() + 1, child.getDepth());
        Assertions.assertTrue(child.startsWith(base));
        Assertions.assertFalse(base.startsWith(child));
        Assertions.assertEquals("intro.md", base.relativize(child));
        Assertions.assertEquals("", base.relativize(base));
        Assertions.assertNull(child.relativize(base));
    }

    @Test
    public void joinIgnoresLeadingSeparatorsAndCollapsesDots() throws Exception {
        Pathname base = Pathname.normalize("/a", POSIX);
        Assertions.assertEquals("/a/b", base.join("/b").toString());
        Assertions.assertEquals("/a/c", base.join("b/../c").toString());
        Assertions.assertEquals("/", base.join("..").toString());
    }

    @Test
    public void resolveTreatsAbsoluteTargetsOnTheirOwn() throws Exception {
        Pathname dir = Pathname.normalize("/var/log", POSIX);
        Assertions.assertEquals("/etc/hosts", dir.resolve("/etc/hosts").toString());
        Assertions.assertEquals("/var/lib", dir.resolve("../lib").toString());
    }

    @Test
    public void basenameSuffixIsOnlyStrippedWhenShorter() throws Exception {
        Pathname readme = Pathname.normalize("/README.md", POSIX);
        Assertions.assertEquals("README", readme.getBasename(".md"));
        Assertions.assertEquals("README.md", readme.getBasename(".txt"));

        Pathname bare = Pathname.normalize("/.md", POSIX);
        Assertions.assertEquals(".md", bare.getBasename(".md"));
    }

    @Test
    public void extensionIgnoresLeadingDot() throws Exception {
        Assertions.assertEquals("gz", Pathname.normalize("/a/archive.tar.gz", POSIX).getExtension());
        Assertions.assertEquals("", Pathname.normalize("/a/.profile", POSIX).getExtension());
        Assertions.assertEquals("", Pathname.normalize("/a/Makefile", POSIX).getExtension());
        Assertions.assertEquals("", Pathname.normalize("/a/trailing.", POSIX).getExtension());
    }

    @Test
    public void hiddenFollowsTheConventionsMarker() throws Exception {
        Assertions.assertTrue(Pathname.normalize("/a/.git", POSIX).isHidden());
        Assertions.assertFalse(Pathname.normalize("/a/git", POSIX).isHidden());

        PathConventions underscore = POSIX.withHiddenMarker('_');
        Assertions.assertTrue(Pathname.normalize("/a/_build", underscore).isHidden());
        Assertions.assertFalse(Pathname.normalize("/a/.git", underscore).isHidden());
        Assertions.assertEquals(Visibility.HIDDEN, Visibility.of(Pathname.normalize("/_x", underscore)));
    }

    @Test
    public void driveLettersAreUpperCased() throws Exception {
        PathConventions windows = PathConventions.WINDOWS;

        Pathname p = Pathname.normalize("c:\\Users\\me\\..\\Public", windows);
        Assertions.assertEquals("C:/Users/Public", p.toString());
        Assertions.assertEquals("C:/", p.getRoot());
        Assertions.assertEquals(p, Pathname.normalize("C:/Users/Public/", windows));
        Assertions.assertEquals("C:/", Pathname.normalize("c:", windows).toString());
        Assertions.assertTrue(Pathname.isAbsolute("D:\\x", windows));

        // Without drive-letter support "c:" is just a name.
        Assertions.assertEquals("/c:/x", Pathname.normalize("c:/x", POSIX).toString());
    }

    @Test
    public void urlSchemeAndAuthorityAreCanonical() throws Exception {
        PathConventions mem = PathConventions.url("MEM", "Host");

        Pathname p = Pathname.normalize("mem://host/a/./b/", mem);
        Assertions.assertEquals("mem://host/a/b", p.toString());
        Assertions.assertEquals(p, Pathname.normalize("MEM://HOST/a/b", mem));
        Assertions.assertEquals(p, Pathname.normalize("/a/b", mem));
        Assertions.assertEquals("mem://host/", Pathname.root(mem).toString());
    }

    @Test
    public void foreignSchemeIsRejected() {
        PathConventions mem = PathConventions.url("mem", "host");
        Assertions.assertThrows(InvalidPathnameException.class, () -> Pathname.normalize("ftp://host/a", mem));
        Assertions.assertThrows(InvalidPathnameException.class, () -> Pathname.normalize("mem://other/a", mem));
    }

    @Test
    public void schemeLookalikeIsAPlainPathWithoutAScheme() throws Exception {
        Pathname p = Pathname.normalize("a://b", POSIX);
        Assertions.assertEquals("/a:/b", p.toString());
        Assertions.assertEquals(List.of("a:", "b"), p.getSegments());
        Assertions.assertFalse(Pathname.isAbsolute("a://b", POSIX));
        Assertions.assertEquals("/x/a:/b", Pathname.normalize("/x", POSIX).resolve("a://b").toString());
    }

    @Test
    public void orderingUsesTheCanonicalString() throws Exception {
        Map<Pathname, String> sorted = new TreeMap<>();
        sorted.put(Pathname.normalize("/b", POSIX), "b");
        sorted.put(Pathname.normalize("/a/z", POSIX), "z");
        sorted.put(Pathname.normalize("/a", POSIX), "a");

        Assertions.assertEquals(List.of("a", "z", "b"), List.copyOf(sorted.values()));
    }
}
