package org.devios.shell;

import org.devios.shell.command.Choreography;
import org.devios.shell.command.CommandDispatcher;
import org.devios.shell.command.CommandOutcome;
import org.devios.shell.dto.ExecuteResult;
import org.devios.shell.dto.ResultRecord;
import org.devios.shell.dto.SessionSnapshot;
import org.devios.shell.dto.TranscriptEntry;
import org.devios.shell.sequencer.Script;
import org.devios.shell.sequencer.ScriptedSequencer;
import org.devios.shell.sequencer.Transcript;
import org.devios.shell.session.ShellSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 终端会话的对外入口：提交一行、查询提示符与会话状态、读取输出历史，以及 Ctrl-C / Ctrl-D / Ctrl-L 与历史导航。
 * <p>
 * 所有入口方法互斥执行，同一时间只处理一条命令；定时脚本在命令返回后异步追加到 {@link Transcript}。
 */
public class ShellEngine {

    private static final Logger log = LoggerFactory.getLogger(ShellEngine.class);

    private final ShellSession session;
    private final CommandDispatcher dispatcher;
    private final Transcript transcript;
    private final ScriptedSequencer sequencer;
    private final Choreography choreography;
    private final String hostName;

    public ShellEngine(ShellSession session, CommandDispatcher dispatcher, Transcript transcript,
                       ScriptedSequencer sequencer, Choreography choreography, String hostName) {
        this.session = session;
        this.dispatcher = dispatcher;
        this.transcript = transcript;
        this.sequencer = sequencer;
        this.choreography = choreography;
        this.hostName = hostName;
        transcript.resetTo(choreography.welcomeBanner(session.language()));
    }

    /**
     * 执行一行输入，返回第一批结果。
     */
    public List<ResultRecord> execute(String line) {
        return submit(line).records();
    }

    /**
     * 执行一行输入。
     * <ul>
     *   <li>空行：追加一条空条目，不分发、不进历史；</li>
     *   <li>等待 sudo 密码时：不回显、不进历史；</li>
     *   <li>{@code clear}：清空输出历史，不追加条目；</li>
     *   <li>登出：追加登出结果后重置会话。</li>
     * </ul>
     * 输出条目先入列，脚本随后启动，所以脚本追加的内容总是落在本条命令的条目上。
     */
    public synchronized ExecuteResult submit(String rawLine) {
        String line = rawLine == null ? "" : rawLine;
        String promptBefore = prompt();
        boolean secret = session.isAwaitingSecret();
        if (line.isBlank()) {
            transcript.addEntry("", List.of());
            return new ExecuteResult(promptBefore, "", List.of(), prompt(), secret);
        }
        String echoed = secret ? "" : line.trim();
        if (!secret) {
            session.recordHistory(line.trim());
        }

        CommandOutcome outcome = dispatcher.dispatch(session, line.trim());
        apply(echoed, outcome);
        return new ExecuteResult(promptBefore, echoed, outcome.records(), prompt(), session.isAwaitingSecret());
    }

    /**
     * Ctrl-C：丢弃正在输入的内容并记一条 {@code ^C}。只作用于输入行：已在运行的脚本不受影响，
     * 等待中的 sudo 认证也保持不变（此时输入内容是密码，不回显）。
     */
    public synchronized List<ResultRecord> interrupt(String pendingInput) {
        boolean secret = session.isAwaitingSecret();
        List<ResultRecord> records = List.of(ResultRecord.error(ErrorKind.INTERRUPTED, "^C"));
        transcript.addEntry(secret || pendingInput == null ? "" : pendingInput, records);
        return records;
    }

    /**
     * Ctrl-D：输入为空时登出，否则什么也不做。
     *
     * @return 是否登出
     */
    public synchronized boolean endOfInput(String pendingInput) {
        if (pendingInput != null && !pendingInput.isEmpty()) {
            return false;
        }
        apply("", choreography.logout(session.language()));
        return true;
    }

    /**
     * Ctrl-L。
     */
    public synchronized void clearScreen() {
        transcript.clear();
    }

    public synchronized Optional<String> historyPrevious() {
        return session.historyPrevious();
    }

    public synchronized Optional<String> historyNext() {
        return session.historyNext();
    }

    /**
     * 提示符：{@code 用户@主机:当前目录$}，提权后用户显示为 root。
     */
    public synchronized String prompt() {
        return session.displayUser() + "@" + hostName + ":" + session.cwd() + "$";
    }

    public synchronized SessionSnapshot snapshot() {
        return new SessionSnapshot(
                session.actor(),
                session.isPrivileged(),
                new ArrayList<>(session.groups()),
                session.cwd(),
                session.previousCwd().orElse(null),
                session.featureLevel().name(),
                session.language().tag(),
                session.isDarkTheme(),
                session.isAwaitingSecret(),
                session.history().size(),
                prompt());
    }

    public List<TranscriptEntry> transcript() {
        return transcript.snapshot();
    }

    /**
     * 所有已启动的脚本都执行完后完成。
     */
    public CompletableFuture<Void> whenIdle() {
        return sequencer.whenIdle();
    }

    private void apply(String echoed, CommandOutcome outcome) {
        if (outcome.clearScreen()) {
            transcript.clear();
        } else {
            transcript.addEntry(echoed, outcome.records());
        }
        if (outcome.logout()) {
            session.reset();
            log.info("会话已登出并恢复初始状态");
        }
        for (Script script : outcome.scripts()) {
            sequencer.run(script, transcript);
        }
    }
}
