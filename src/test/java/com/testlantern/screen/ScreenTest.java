package com.testlantern.screen;

import com.testlantern.error.FailureCategory;
import com.testlantern.error.ScenarioException;
import com.testlantern.progress.Action;
import com.testlantern.progress.ProgressEvaluator;
import com.testlantern.progress.TestProgress;
import com.testlantern.support.FakeClock;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ScreenTest {

    private FakeClock         clock;
    private ProgressEvaluator evaluator;

    @BeforeMethod
    public void setUp() {
        clock     = new FakeClock();
        evaluator = new ProgressEvaluator();
    }

    private Screen.Builder home() {
        return Screen.builder("Home").waiter(clock.waiter(Duration.ofMillis(100)));
    }

    // ════════════════════════════════════════════════════════════════════════
    // Activation policies
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void immediate_isAlwaysActive() {
        Screen screen = home().activeWhen(() -> false).build();

        assertThat(screen.isActive()).isTrue();
        assertThatCode(screen::becomesActive).doesNotThrowAnyException();
        assertThat(clock.millis()).isZero();
    }

    @Test
    public void delayed_waitsUntilProbeIsTrue() {
        AtomicInteger polls = new AtomicInteger();
        Screen screen = home()
            .policy(ActivationPolicy.delayed(Duration.ofSeconds(3)))
            .activeWhen(() -> polls.incrementAndGet() >= 4)
            .build();

        screen.becomesActive();

        assertThat(clock.millis()).isEqualTo(300);
    }

    @Test
    public void delayed_timeout_isIncorrectScreen() {
        Screen screen = home()
            .policy(ActivationPolicy.delayed(Duration.ofSeconds(1)))
            .activeWhen(() -> false)
            .build();

        assertThatThrownBy(screen::becomesActive)
            .isInstanceOfSatisfying(ScenarioException.class,
                e -> assertThat(e.getCategory()).isEqualTo(FailureCategory.INCORRECT_SCREEN))
            .hasMessageStartingWith("[Home isActive]");
    }

    @Test
    public void transient_softWindowRestartsWhileIndicatorShows() {
        AtomicInteger polls = new AtomicInteger();
        Screen screen = home()
            .policy(ActivationPolicy.withTransient(Duration.ofMillis(300), Duration.ofSeconds(5)))
            .transientWhen(() -> polls.incrementAndGet() <= 8)   // spinner for 800ms
            .activeWhen(() -> true)
            .build();

        screen.becomesActive();

        assertThat(clock.millis()).isEqualTo(800);
    }

    @Test
    public void transient_softTimeout_whenNothingHappens() {
        Screen screen = home()
            .policy(ActivationPolicy.withTransient(Duration.ofMillis(300), Duration.ofSeconds(5)))
            .activeWhen(() -> false)
            .build();

        assertThatThrownBy(screen::becomesActive)
            .isInstanceOf(ScenarioException.class)
            .hasMessage("[Home becomesActive] failed soft timeout");
    }

    @Test
    public void transient_hardTimeout_whenIndicatorNeverGoesAway() {
        Screen screen = home()
            .policy(ActivationPolicy.withTransient(Duration.ofMillis(300), Duration.ofSeconds(1)))
            .transientWhen(() -> true)
            .activeWhen(() -> true)
            .build();

        assertThatThrownBy(screen::becomesActive)
            .isInstanceOf(ScenarioException.class)
            .hasMessage("[Home becomesActive] failed hard timeout");
        // the hard limit is exclusive, so one more poll runs at 1000ms
        assertThat(clock.millis()).isEqualTo(1100);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Action builders
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void action_isTiedToTheScreen() {
        Screen screen = home().build();
        Action<Integer> tap = screen.step("tap", () -> { });

        assertThat(tap.getScreen()).containsSame(screen);
        assertThat(tap.description()).isEqualTo("Home.tap");
    }

    @Test
    public void composite_empty_isDeveloperError() {
        Screen screen = home().build();

        assertThatThrownBy(() -> screen.<Integer>composite("nothing", List.of()))
            .isInstanceOfSatisfying(ScenarioException.class,
                e -> assertThat(e.getCategory()).isEqualTo(FailureCategory.DEVELOPER_ERROR))
            .hasMessageContaining("from none");
    }

    @Test
    public void composite_single_isThatAction() {
        Screen screen = home().build();
        Action<Integer> only = screen.action("inc", s -> s + 1);

        assertThat(screen.composite("wrapper", List.of(only))).isSameAs(only);
    }

    @Test
    public void composite_many_chainsStateThroughEachTask() {
        Screen screen = home().build();
        Action<Integer> both = screen.composite("incThenDouble", List.of(
            screen.<Integer>action("inc", s -> s + 1),
            screen.<Integer>action("double", s -> s * 2)));

        TestProgress<Integer> p = evaluator.apply(TestProgress.passing(3), both);

        assertThat(p).isEqualTo(TestProgress.passing(8));
        assertThat(both.description()).isEqualTo("Home.incThenDouble");
    }

    @Test
    public void verifyIsActive_failsWhenScreenNeverShows() {
        Screen screen = home()
            .policy(ActivationPolicy.delayed(Duration.ofMillis(200)))
            .activeWhen(() -> false)
            .build();

        TestProgress<Integer> p = evaluator.apply(TestProgress.passing(0), screen.verifyIsActive());

        assertThat(p.isFailing()).isTrue();
        assertThat(p.getMessages()).singleElement().asString().startsWith("verifyIsActive failed screen check:");
    }

    // ════════════════════════════════════════════════════════════════════════
    // verifyNotActive
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void verifyNotActive_passesOnceScreenGoesAway() {
        AtomicInteger polls = new AtomicInteger();
        Screen screen = home()
            .policy(ActivationPolicy.delayed(Duration.ofSeconds(1)))
            .activeWhen(() -> polls.incrementAndGet() < 3)
            .build();

        Action<Integer> verify = screen.verifyNotActive();
        TestProgress<Integer> p = evaluator.apply(TestProgress.passing(0), verify);

        assertThat(p.isPassing()).isTrue();
        assertThat(verify.description()).isEqualTo("null screen.verifyNotActive");
    }

    @Test
    public void verifyNotActive_screenStaysUp_fails() {
        Screen screen = home()
            .policy(ActivationPolicy.delayed(Duration.ofMillis(300)))
            .activeWhen(() -> true)
            .build();

        TestProgress<Integer> p = evaluator.apply(TestProgress.passing(0), screen.verifyNotActive());

        assertThat(p.getMessages()).containsExactly("verifyNotActive failed screen check: Home failed to become inactive");
    }

    @Test
    public void verifyNotActive_immediateScreen_neverGoesAway() {
        TestProgress<Integer> p = evaluator.apply(TestProgress.passing(0), home().build().verifyNotActive());

        assertThat(p.getMessages()).containsExactly("verifyNotActive failed screen check: Home is always active");
    }

    @Test
    public void verifyNotActive_transientScreen_waitsOutTheIndicator() {
        AtomicInteger polls = new AtomicInteger();
        Screen screen = home()
            .policy(ActivationPolicy.withTransient(Duration.ofMillis(300), Duration.ofSeconds(5)))
            .transientWhen(() -> polls.incrementAndGet() <= 2)
            .activeWhen(() -> false)
            .build();

        TestProgress<Integer> p = evaluator.apply(TestProgress.passing(0), screen.verifyNotActive());

        assertThat(p.isPassing()).isTrue();
        assertThat(clock.millis()).isEqualTo(200);
    }

    @Test
    public void policy_toString_namesKindAndTimeouts() {
        assertThat(ActivationPolicy.immediate()).hasToString("IMMEDIATE");
        assertThat(ActivationPolicy.delayed(Duration.ofSeconds(2))).hasToString("DELAYED(2000ms)");
        assertThat(ActivationPolicy.withTransient(Duration.ofMillis(300), Duration.ofSeconds(5)))
            .hasToString("WITH_TRANSIENT(soft=300ms, hard=5000ms)");
    }
}
