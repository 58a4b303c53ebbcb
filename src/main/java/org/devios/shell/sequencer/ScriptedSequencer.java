package org.devios.shell.sequencer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 定时多步输出的调度器。
 * <p>
 * 每个步骤只在上一步执行完之后才开始计时（链式调度），所以即使调度有延迟，后一步也不可能先于前一步可见。
 * 所有步骤都跑在同一个单线程调度器上；脚本一旦开始就会跑完，中断输入（Ctrl-C）不会取消它。
 */
public class ScriptedSequencer {

    private static final Logger log = LoggerFactory.getLogger(ScriptedSequencer.class);

    private final ScheduledExecutorService scheduler;
    private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();

    public ScriptedSequencer(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * 开始执行脚本。
     *
     * @return 全部步骤执行完后完成；某一步抛出异常时以该异常失败，后续步骤不再执行
     */
    public CompletableFuture<Void> run(Script script, Transcript transcript) {
        CompletableFuture<Void> completion = new CompletableFuture<>();
        inFlight.add(completion);
        completion.whenComplete((ignored, error) -> inFlight.remove(completion));
        log.info("开始执行脚本 {}（{} 步）", script.name(), script.steps().size());
        scheduleStep(script, 0, transcript, completion);
        return completion;
    }

    /**
     * 当前所有正在执行的脚本都结束后完成。
     */
    public CompletableFuture<Void> whenIdle() {
        return CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0]))
                .handle((ignored, error) -> null);
    }

    public int activeCount() {
        return inFlight.size();
    }

    /**
     * 停止调度器。尚未跑完的脚本以 {@link CancellationException} 结束，等待它们的调用方不会一直挂起。
     */
    public void shutdown() {
        scheduler.shutdownNow();
        List<CompletableFuture<Void>> pending = new ArrayList<>(inFlight);
        if (!pending.isEmpty()) {
            log.warn("调度器关闭，取消 {} 个未完成的脚本", pending.size());
        }
        for (CompletableFuture<Void> completion : pending) {
            completion.completeExceptionally(new CancellationException("调度器已关闭"));
        }
    }

    private void scheduleStep(Script script, int index, Transcript transcript, CompletableFuture<Void> completion) {
        if (index >= script.steps().size()) {
            log.info("脚本 {} 执行完成", script.name());
            completion.complete(null);
            return;
        }
        Script.Step step = script.steps().get(index);
        try {
            scheduler.schedule(() -> {
                try {
                    step.action().accept(transcript);
                } catch (RuntimeException e) {
                    log.error("脚本 {} 第 {} 步执行失败", script.name(), index + 1, e);
                    completion.completeExceptionally(e);
                    return;
                }
                scheduleStep(script, index + 1, transcript, completion);
            }, step.delay().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("调度器已关闭，脚本 {} 在第 {} 步中止", script.name(), index + 1);
            completion.completeExceptionally(e);
        }
    }
}
