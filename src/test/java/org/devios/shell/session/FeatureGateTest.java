package org.devios.shell.session;

import org.devios.shell.ShellFixture;
import org.devios.shell.fs.PathResolver;
import org.devios.shell.fs.ResolvedPath;
import org.devios.shell.fs.VirtualFileTree;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FeatureGateTest {

    private final VirtualFileTree tree = ShellFixture.loadTree("/shell/tree.json", Clock.systemUTC());
    private final PathResolver resolver = new PathResolver(tree);
    private final FeatureGate gate = new FeatureGate(Set.of("about", ".github"), Set.of("ls", "HELP"));
    private final ShellSession session = new ShellSession("user", Set.of("users"), Language.EN_US);

    @Test
    void restricted_hidesGatedRootChildrenDuringResolution() {
        assertThat(gate.isRootChildHidden(session, "about")).isTrue();
        assertThat(gate.isRootChildHidden(session, "skills")).isFalse();
        assertThat(resolver.resolve("about/bio.txt", "~", name -> gate.isRootChildHidden(session, name))).isEmpty();
        assertThat(resolver.resolve("about/../skills", "~", name -> gate.isRootChildHidden(session, name))).isEmpty();
        assertThat(resolver.resolve("skills", "~", name -> gate.isRootChildHidden(session, name))).isPresent();
    }

    @Test
    void restricted_hidesOnlyRootChildrenInListings() {
        ResolvedPath root = resolver.resolve("~", "~").orElseThrow();
        ResolvedPath skills = resolver.resolve("skills", "~").orElseThrow();

        assertThat(gate.isChildHidden(session, root, ".github")).isTrue();
        assertThat(gate.isChildHidden(session, skills, "about")).isFalse();
    }

    @Test
    void commands_areCaseInsensitive() {
        assertThat(gate.isCommandAvailable(session, "LS")).isTrue();
        assertThat(gate.isCommandAvailable(session, "help")).isTrue();
        assertThat(gate.isCommandAvailable(session, "sudo")).isFalse();
    }

    @Test
    void fullMode_showsEverything() {
        session.unlockFullFeatures("deviser");

        assertThat(gate.isRootChildHidden(session, "about")).isFalse();
        assertThat(gate.isChildHidden(session, resolver.resolve("~", "~").orElseThrow(), "about")).isFalse();
        assertThat(gate.isCommandAvailable(session, "sudo")).isTrue();
    }
}
