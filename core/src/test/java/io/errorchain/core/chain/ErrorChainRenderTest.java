package io.errorchain.core.chain;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for the single-line rendering of {@link ErrorChain}. */
class ErrorChainRenderTest {

    // ── Plain derivation ──

    @Test
    void rootRendersItsText() {
        assertThat(ErrorChain.of("base").render()).isEqualTo("base");
    }

    @Test
    void rootTextIsNeverTreatedAsFormat() {
        assertThat(ErrorChain.of("%s error").render()).isEqualTo("%s error");
    }

    @Test
    void oneDerivationIsSeparatedWithColon() {
        assertThat(ErrorChain.of("base").wrap("s1").render()).isEqualTo("base: s1");
    }

    @Test
    void twoDerivationsSetOffLastMessage() {
        assertThat(ErrorChain.of("base").wrap("s1").wrap("s2").render()).isEqualTo("base: s1 > s2");
    }

    @Test
    void intermediateDerivationsAreJoinedOldestFirst() {
        ErrorChain base = ErrorChain.of("base");

        assertThat(base.wrap("s1").wrap("s2").wrap("s3").render()).isEqualTo("base: s1; s2 > s3");
        assertThat(base.wrap("s1").wrap("s2").wrap("s3").wrap("s4").render())
                .isEqualTo("base: s1; s2; s3 > s4");
    }

    @Test
    void ancestorsWithEmptyTextAreSkipped() {
        assertThat(ErrorChain.of("base").wrap("").wrap("s1").render()).isEqualTo("base: s1");
    }

    // ── Templates ──

    @Test
    @DisplayName("Template root filled with arguments renders the formatted text")
    void templateRootWithArgs() {
        assertThat(ErrorChain.ofTemplate("v=%d").withArgs(7).render()).isEqualTo("v=7");
        assertThat(ErrorChain.ofTemplate("%s error").withArgs("test").render()).isEqualTo("test error");
    }

    @Test
    void unfilledTemplateRendersEmpty() {
        assertThat(ErrorChain.ofTemplate("v=%d").render()).isEmpty();
    }

    @Test
    void unfilledTemplateLeafOmitsTrailingSeparator() {
        assertThat(ErrorChain.of("base").wrapTemplate("sub%s").render()).isEqualTo("base");
        assertThat(ErrorChain.of("base").wrap("s1").wrapTemplate("sub%s").render()).isEqualTo("base: s1");
    }

    @Test
    void templatesAreSkippedAcrossMultiStageChains() {
        ErrorChain base = ErrorChain.of("base");

        assertThat(base.wrapTemplate("sub%s").withArgs("1").render()).isEqualTo("base: sub1");
        assertThat(base.wrapTemplate("sub%s")
                        .withArgs("1")
                        .wrapTemplate("sub%s")
                        .withArgs("2")
                        .wrapTemplate("sub%s")
                        .withArgs("3")
                        .wrapTemplate("sub%s")
                        .withArgs("4")
                        .render())
                .isEqualTo("base: sub1; sub2; sub3 > sub4");
    }

    @Test
    void argsOnPlainNodeAreDerivedAsText() {
        assertThat(ErrorChain.of("%s error").withArgs("test").render()).isEqualTo("%s error: test");
        assertThat(ErrorChain.of("base").withArgs("a", 1, null).render()).isEqualTo("base: a 1 null");
    }

    // ── Causes ──

    @Test
    void causeFollowsTheNodeMessage() {
        ErrorChain err = ErrorChain.of("A").wrap("B").wrapCause("C", ErrorChain.of("D"));

        assertThat(err.render()).isEqualTo("A: B > C < D");
    }

    @Test
    void causeChainRendersRecursively() {
        ErrorChain cause = ErrorChain.of("cause").wrapCause("deep", ErrorChain.of("cause"));
        ErrorChain err = ErrorChain.of("base").wrap("sub1").wrapCause("fail", cause);

        assertThat(err.render()).isEqualTo("base: sub1 > fail < cause: deep < cause");
    }

    @Test
    void causeWithArgsFillsTemplate() {
        ErrorChain err = ErrorChain.of("base").wrapTemplate("%s").wrapCauseWithArgs(ErrorChain.of("cause"), "error");

        assertThat(err.render()).isEqualTo("base: error < cause");
    }

    @Test
    @DisplayName("Ancestor causes render next to the ancestor that carries them")
    void ancestorCausesRenderInPlace() {
        ErrorChain base = ErrorChain.of("base").wrapCause("base error", ErrorChain.of("basecause"));
        ErrorChain cause = ErrorChain.of("cause").wrapCause("cause error", ErrorChain.of("causecause"));

        assertThat(base.wrapCause("error", cause).render())
                .isEqualTo("base: base error < basecause > error < cause: cause error < causecause");
    }

    @Test
    void foreignCauseRendersItsMessage() {
        ErrorChain err = ErrorChain.of("store").wrap("write").wrapCause("segment 7", new IOException("disk full"));

        assertThat(err.render()).isEqualTo("store: write > segment 7 < disk full");
    }

    @Test
    void foreignCauseWithoutMessageRendersItsToString() {
        ErrorChain err = ErrorChain.of("store").wrapCause("flush", new IllegalStateException());

        assertThat(err.render()).isEqualTo("store: flush < java.lang.IllegalStateException");
    }

    @Test
    void nullCauseIsIgnored() {
        assertThat(ErrorChain.of("base").wrapCause("fail", null).render()).isEqualTo("base: fail");
    }

    // ── Extras ──

    @Test
    void extrasAreAppendedInInsertionOrder() {
        ErrorChain err = ErrorChain.of("base")
                .extra(ErrorChain.of("extra1"))
                .extra(ErrorChain.of("extra2"))
                .extra(ErrorChain.of("extra3"));

        assertThat(err.render()).isEqualTo("base + extra1 + extra2 + extra3");
    }

    @Test
    void extrasFollowTheWholeChain() {
        ErrorChain err = ErrorChain.of("base")
                .wrap("s1")
                .wrapCause("s2", new IOException("io"))
                .extra(ErrorChain.of("x").wrap("y"))
                .extra(new IllegalArgumentException("bad"));

        assertThat(err.render()).isEqualTo("base: s1 > s2 < io + x: y + bad");
    }

    // ── Throwable integration ──

    @Test
    void getMessageIsTheRenderedForm() {
        ErrorChain err = ErrorChain.of("base").wrap("s1").wrap("s2");

        assertThat(err.getMessage()).isEqualTo("base: s1 > s2");
        assertThat(err.getLocalizedMessage()).isEqualTo("base: s1 > s2");
        assertThat(err).hasMessage("base: s1 > s2");
    }

    @Test
    void renderIsIdempotent() {
        ErrorChain err = ErrorChain.of("a")
                .wrap("b")
                .wrapCause("c", ErrorChain.of("d"))
                .extra(ErrorChain.of("e"));

        assertThat(err.render()).isEqualTo(err.render());
    }
}
