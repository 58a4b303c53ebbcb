package org.devios.shell.command;

import org.devios.shell.ErrorKind;
import org.devios.shell.ShellMessages;
import org.devios.shell.ShellProperties;
import org.devios.shell.dto.ResultRecord;
import org.devios.shell.sequencer.Script;
import org.devios.shell.session.Language;
import org.devios.shell.session.ShellSession;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 多步动画输出的编排：服务启动、下载进度、rm -rf 诱饵、语言切换横幅、登出后重新登入。
 * <p>
 * 每个方法返回第一批结果加上对应脚本；脚本文本在步骤执行时按发起命令时的语言取出。
 * 树在任何步骤中都不会被修改。
 */
public class Choreography {

    private static final int BOOT_MESSAGES = 5;
    private static final int DOWNLOAD_STEPS = 10;
    private static final List<String> PRANK_PATHS = List.of(
            "/home/deviser/Documents",
            "/home/deviser/Pictures",
            "/home/deviser/Downloads",
            "/home/deviser/.config",
            "/home/deviser/.local/share",
            "/var/log",
            "/etc/apt"
    );
    private static final DateTimeFormatter KERNEL_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneOffset.UTC);

    private final ShellMessages messages;
    private final ShellProperties properties;
    private final Clock clock;

    public Choreography(ShellMessages messages, ShellProperties properties, Clock clock) {
        this.messages = messages;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 启动时显示的欢迎横幅。
     */
    public List<ResultRecord> welcomeBanner(Language language) {
        return List.of(
                ResultRecord.system(messages.get(language, "banner.welcome")),
                ResultRecord.success(messages.get(language, "banner.lastLogin", messages.now(language, clock))),
                ResultRecord.system(messages.get(language, "banner.version")),
                ResultRecord.info(messages.get(language, "banner.help"))
        );
    }

    /**
     * 登出后重新登入时的横幅。
     */
    public List<ResultRecord> reloginBanner(Language language) {
        return List.of(
                ResultRecord.system(messages.get(language, "relogin.welcome")),
                ResultRecord.info(messages.get(language, "banner.help"))
        );
    }

    /**
     * {@code deviser start}：逐条追加启动信息，显示成功后清屏，再放一条欢迎信息。
     */
    public CommandOutcome boot(Language language) {
        Script.Builder script = Script.named("deviser-boot");
        for (int i = 1; i <= BOOT_MESSAGES; i++) {
            String code = "deviser.boot." + i;
            script.then(properties.getBootStepDelay(),
                    transcript -> transcript.appendToTail(List.of(ResultRecord.system(messages.get(language, code)))));
        }
        script.then(properties.getBootSettleDelay(),
                        transcript -> transcript.appendToTail(List.of(ResultRecord.success(messages.get(language, "deviser.started")))))
                .then(properties.getBootClearDelay(), transcript -> transcript.clear())
                .then(properties.getBootWelcomeDelay(),
                        transcript -> transcript.resetTo(List.of(ResultRecord.success(messages.get(language, "deviser.welcome")))));
        return CommandOutcome.of(ResultRecord.system(messages.get(language, "deviser.starting")))
                .withScript(script.build());
    }

    /**
     * 对二进制文件 cat：进度条每 10% 刷新一次最后一条输出，完成后追加文件内容。
     */
    public CommandOutcome download(Language language, String fileName, List<String> content) {
        Script.Builder script = Script.named("download-" + fileName);
        for (int step = 1; step <= DOWNLOAD_STEPS; step++) {
            int percent = step * 10;
            Duration delay = step == 1 ? properties.getDownloadStartDelay() : properties.getDownloadStepDelay();
            script.then(delay, transcript -> transcript.replaceTail(List.of(
                    ResultRecord.system(messages.get(language, "download.progress", fileName)),
                    ResultRecord.system(progressBar(percent)))));
        }
        script.then(properties.getDownloadFinishDelay(), transcript -> {
            List<ResultRecord> done = new ArrayList<>();
            done.add(ResultRecord.success(messages.get(language, "download.done")));
            content.forEach(line -> done.add(ResultRecord.system(line)));
            transcript.appendToTail(done);
        });
        return CommandOutcome.of(
                ResultRecord.system(messages.get(language, "download.prepare", fileName)),
                ResultRecord.system(progressBar(0))
        ).withScript(script.build());
    }

    /**
     * 递归强制删除的诱饵流程：假装逐个目录删除，报告统计，再揭晓是个玩笑并“还原快照”。
     */
    public CommandOutcome prank(ShellSession session) {
        Language language = session.language();
        String user = session.displayUser();
        String host = properties.getHostName();

        Script.Builder script = Script.named("rm-prank");
        for (int i = 0; i < PRANK_PATHS.size(); i++) {
            String percent = String.valueOf(i * 100 / PRANK_PATHS.size());
            String path = PRANK_PATHS.get(i);
            Duration delay = i == 0 ? properties.getPrankStartDelay() : properties.getPrankStepDelay();
            script.then(delay, transcript -> transcript.appendToTail(List.of(
                    ResultRecord.system(messages.get(language, "prank.progress", percent, path)))));
        }
        script.then(properties.getPrankStepDelay().plus(properties.getPrankStartDelay()),
                        transcript -> transcript.appendToTail(List.of(
                                ResultRecord.error(ErrorKind.PERMISSION_DENIED, messages.get(language, "prank.denied.1")),
                                ResultRecord.error(ErrorKind.PERMISSION_DENIED, messages.get(language, "prank.denied.2")),
                                ResultRecord.error(ErrorKind.PERMISSION_DENIED, messages.get(language, "prank.denied.3")))))
                .then(properties.getPrankPhaseDelay(),
                        transcript -> transcript.appendToTail(List.of(ResultRecord.system(messages.get(language, "prank.files")))))
                .then(properties.getPrankPhaseDelay(),
                        transcript -> transcript.appendToTail(List.of(ResultRecord.system(messages.get(language, "prank.directories")))))
                .then(properties.getPrankPhaseDelay(),
                        transcript -> transcript.appendToTail(List.of(
                                ResultRecord.success(messages.get(language, "prank.finished")),
                                ResultRecord.system(messages.get(language, "prank.skipped")))))
                .then(properties.getPrankRevealDelay(), transcript -> {
                    String time = KERNEL_TIME.format(clock.instant());
                    transcript.appendToTail(List.of(
                            ResultRecord.system("-------------------------------"),
                            ResultRecord.system(messages.get(language, "prank.alert.kernel", time)),
                            ResultRecord.error(ErrorKind.PERMISSION_DENIED, messages.get(language, "prank.alert.danger")),
                            ResultRecord.warning(messages.get(language, "prank.alert.guard")),
                            ResultRecord.system(messages.get(language, "prank.alert.restoring", time)),
                            ResultRecord.error(ErrorKind.PERMISSION_DENIED, messages.get(language, "prank.alert.blocked")),
                            ResultRecord.system(messages.get(language, "prank.alert.loading")),
                            ResultRecord.warning(messages.get(language, "prank.alert.reveal"))));
                })
                .then(properties.getPrankRestoreDelay(), transcript -> transcript.addEntry("", List.of(
                        ResultRecord.system(messages.get(language, "prank.restore.snapshot", user, host)),
                        ResultRecord.info(messages.get(language, "prank.restore.time", messages.now(language, clock))),
                        ResultRecord.warning(messages.get(language, "prank.restore.warning")),
                        ResultRecord.success(messages.get(language, "prank.restore.joke")))));

        return CommandOutcome.of(
                ResultRecord.system(messages.get(language, "prank.command", user, host, session.cwd())),
                ResultRecord.success(messages.get(language, "prank.deleting"))
        ).withScript(script.build());
    }

    /**
     * 切换语言：立即确认，随后把输出历史换成新语言的单条横幅。
     */
    public CommandOutcome languageSwitch(Language language) {
        String changed = messages.get(language, "lang.changed");
        Script script = Script.named("language-banner")
                .then(Duration.ZERO, transcript -> transcript.resetTo(List.of(
                        ResultRecord.system(changed),
                        ResultRecord.info(messages.get(language, "banner.help")))))
                .build();
        return CommandOutcome.of(ResultRecord.system(changed)).withScript(script);
    }

    /**
     * exit / logout：两条登出结果，稍后把输出历史换成重新登入横幅。
     */
    public CommandOutcome logout(Language language) {
        Script script = Script.named("relogin")
                .then(properties.getReloginDelay(), transcript -> transcript.resetTo(reloginBanner(language)))
                .build();
        return CommandOutcome.of(
                ResultRecord.logout(messages.get(language, "logout.line")),
                ResultRecord.logout(messages.get(language, "logout.goodbye"))
        ).withScript(script).asLogout();
    }

    static String progressBar(int percent) {
        int filled = percent / 10;
        return "[" + "=".repeat(filled) + " ".repeat(10 - filled) + "] " + percent + "%";
    }
}
