package org.devios.shell.sequencer;

import org.devios.shell.dto.ResultRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScriptedSequencerTest {

    private final ScriptedSequencer sequencer = new ScriptedSequencer(Executors.newSingleThreadScheduledExecutor());
    private final Transcript transcript = new Transcript();

    @AfterEach
    void tearDown() {
        sequencer.shutdown();
    }

    @Test
    void run_appendsStepsToTailInDeclaredOrder() throws Exception {
        transcript.addEntry("start", List.of(ResultRecord.system("0")));
        // 后一步的延迟更短，也必须在前一步之后可见
        Script script = Script.named("ordered")
                .then(Duration.ofMillis(30), t -> t.appendToTail(List.of(ResultRecord.system("1"))))
                .then(Duration.ofMillis(1), t -> t.appendToTail(List.of(ResultRecord.system("2"))))
                .then(Duration.ZERO, t -> t.appendToTail(List.of(ResultRecord.system("3"))))
                .build();

        sequencer.run(script, transcript).get(5, TimeUnit.SECONDS);

        assertThat(transcript.size()).isEqualTo(1);
        assertThat(transcript.tailRecords()).extracting(ResultRecord::text).containsExactly("0", "1", "2", "3");
    }

    @Test
    void run_failingStepStopsChainAndFailsFuture() {
        Script script = Script.named("broken")
                .then(Duration.ZERO, t -> t.appendToTail(List.of(ResultRecord.system("before"))))
                .then(Duration.ZERO, t -> {
                    throw new IllegalStateException("boom");
                })
                .then(Duration.ZERO, t -> t.appendToTail(List.of(ResultRecord.system("after"))))
                .build();

        CompletableFuture<Void> future = sequencer.run(script, transcript);

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(transcript.tailRecords()).extracting(ResultRecord::text).containsExactly("before");
    }

    @Test
    void whenIdle_waitsForAllRunningScripts() throws Exception {
        transcript.addEntry("", List.of());
        sequencer.run(Script.named("a")
                .then(Duration.ofMillis(20), t -> t.appendToTail(List.of(ResultRecord.system("a")))).build(), transcript);
        sequencer.run(Script.named("b")
                .then(Duration.ofMillis(10), t -> t.appendToTail(List.of(ResultRecord.system("b")))).build(), transcript);

        sequencer.whenIdle().get(5, TimeUnit.SECONDS);

        assertThat(transcript.tailRecords()).extracting(ResultRecord::text).containsExactlyInAnyOrder("a", "b");
        assertThat(sequencer.activeCount()).isZero();
    }

    @Test
    void run_afterShutdownFailsImmediately() {
        sequencer.shutdown();

        CompletableFuture<Void> future = sequencer.run(Script.named("late")
                .then(Duration.ZERO, t -> t.clear()).build(), transcript);

        assertThat(future).isCompletedExceptionally();
    }

    @Test
    void shutdown_endsRunningScriptsSoIdleCompletes() throws Exception {
        transcript.addEntry("", List.of());
        CompletableFuture<Void> future = sequencer.run(Script.named("slow")
                .then(Duration.ofSeconds(10), t -> t.appendToTail(List.of(ResultRecord.system("late")))).build(), transcript);

        sequencer.shutdown();

        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(future::join).isInstanceOf(CancellationException.class);
        sequencer.whenIdle().get(1, TimeUnit.SECONDS);
        assertThat(sequencer.activeCount()).isZero();
        assertThat(transcript.tailRecords()).isEmpty();
    }

    @Test
    void transcript_replaceTailAndReset() {
        transcript.addEntry("cat resume.pdf", List.of(ResultRecord.system("[          ] 0%")));
        transcript.replaceTail(List.of(ResultRecord.system("[=====     ] 50%")));

        assertThat(transcript.snapshot()).hasSize(1);
        assertThat(transcript.tailRecords()).extracting(ResultRecord::text).containsExactly("[=====     ] 50%");

        transcript.resetTo(List.of(ResultRecord.info("banner")));
        assertThat(transcript.snapshot()).singleElement()
                .satisfies(entry -> assertThat(entry.command()).isEmpty());
    }

    @Test
    void step_rejectsNegativeDelay() {
        assertThatThrownBy(() -> Script.named("bad").then(Duration.ofMillis(-1), t -> t.clear()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
