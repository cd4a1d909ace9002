package com.zzf.orchestrator.core.policy;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WhitelistMatcherTest {

    private static final Path ROOT = Path.of("/project");

    private final WhitelistMatcher matcher = new WhitelistMatcher();

    @Test
    void nameOnlyPatternMatchesFileNamesUnderRoot() {
        assertTrue(matcher.matchesPath(ROOT.resolve("notes.txt"), ROOT, List.of("*.txt")));
        assertTrue(matcher.matchesPath(ROOT.resolve("sub/notes.txt"), ROOT, List.of("*.txt")));
        assertFalse(matcher.matchesPath(Path.of("/etc/notes.txt"), ROOT, List.of("*.txt")));
    }

    @Test
    void matchingIsCaseSensitive() {
        assertFalse(matcher.matchesPath(ROOT.resolve("notes.txt"), ROOT, List.of("*.TXT")));
    }

    @Test
    void relativePatternsAreAnchoredAtRoot() {
        assertTrue(matcher.matchesPath(ROOT.resolve("docs/guide.md"), ROOT, List.of("docs/*.md")));
        assertFalse(matcher.matchesPath(ROOT.resolve("other/docs/guide.md"), ROOT, List.of("docs/*.md")));
        assertTrue(matcher.matchesPath(ROOT.resolve("docs/guide.md"), ROOT, List.of("./docs/*.md")));
    }

    @Test
    void singleStarDoesNotCrossSegments() {
        assertFalse(matcher.matchesPath(ROOT.resolve("src/a/Main.java"), ROOT, List.of("src/*.java")));
        assertTrue(matcher.matchesPath(ROOT.resolve("src/a/Main.java"), ROOT, List.of("src/**.java")));
    }

    @Test
    void trailingDirectoryPatternAdmitsEverythingBeneath() {
        assertTrue(matcher.matchesPath(ROOT.resolve("data/a/b/c.csv"), ROOT, List.of("data/**")));
        assertTrue(matcher.matchesPath(ROOT.resolve("data/a/b/c.csv"), ROOT, List.of("data/*")));
        assertTrue(matcher.matchesPath(ROOT.resolve("data"), ROOT, List.of("data/**")));
        assertFalse(matcher.matchesPath(ROOT.resolve("database/x.csv"), ROOT, List.of("data/**")));
    }

    @Test
    void questionMarkMatchesOneCharacter() {
        assertTrue(matcher.matchesPath(ROOT.resolve("data/a.csv"), ROOT, List.of("data/?.csv")));
        assertFalse(matcher.matchesPath(ROOT.resolve("data/ab.csv"), ROOT, List.of("data/?.csv")));
    }

    @Test
    void absolutePatternsMatchAbsoluteTargets() {
        assertTrue(matcher.matchesPath(Path.of("/srv/shared/report.txt"), ROOT, List.of("/srv/shared/**")));
        assertFalse(matcher.matchesPath(Path.of("/srv/private/report.txt"), ROOT, List.of("/srv/shared/**")));
    }

    @Test
    void emptyPatternListMatchesNothing() {
        assertFalse(matcher.matchesPath(ROOT.resolve("notes.txt"), ROOT, List.of()));
    }

    @Test
    void commandNamesMatchNameOnlyEntries() {
        assertTrue(matcher.matchesCommandName("git", List.of("ls", "git")));
        assertTrue(matcher.matchesCommandName("python3", List.of("python*")));
        assertFalse(matcher.matchesCommandName("rm", List.of("ls", "git")));
        assertFalse(matcher.matchesCommandName("git", List.of("bin/git")));
    }
}
