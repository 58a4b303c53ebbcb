package org.devios.shell;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.devios.shell.session.Language;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * 虚拟终端的业务配置（{@code app.shell.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>身份相关：初始用户、解锁后的服务用户、所属组、sudo 密码与最大尝试次数。</li>
 *   <li>受限模式：隐藏的顶层目录与受限模式下可用的命令。</li>
 *   <li>动画编排：各段定时输出的延迟（全部是固定常量，测试里可以改成 0）。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.shell")
public class ShellProperties {

    /**
     * 提示符中的主机名。
     */
    @NotBlank
    private String hostName = "terminal";

    /**
     * 会话开始时的用户。
     */
    @NotBlank
    private String initialUser = "user";

    /**
     * {@code deviser start} 之后的用户。
     */
    @NotBlank
    private String serviceUser = "deviser";

    @NotEmpty
    private List<String> groups = List.of("users");

    /**
     * sudo 密码（演示用，不是安全边界）。
     */
    @NotBlank
    private String sudoSecret = "password";

    /**
     * 连续失败多少次后放弃本次 sudo。
     */
    @Min(1)
    private int maxAuthAttempts = 3;

    @NotNull
    private Language defaultLanguage = Language.ZH_TW;

    /**
     * 受限模式下隐藏的顶层目录。
     */
    @NotNull
    private List<String> gatedNames = List.of("about", "skills", "projects", "contact", ".github");

    /**
     * 受限模式下可用的命令。
     */
    @NotNull
    private List<String> basicCommands = List.of(
            "help", "clear", "echo", "exit", "deviser", "ls", "cd", "cat", "pwd", "whoami", "date", "uname", "lang"
    );

    /**
     * 文件树描述资源（Spring Resource 路径）。
     */
    @NotBlank
    private String treeLocation = "classpath:shell/tree.json";

    @NotNull
    private Duration bootStepDelay = Duration.ofMillis(600);

    @NotNull
    private Duration bootSettleDelay = Duration.ofMillis(800);

    @NotNull
    private Duration bootClearDelay = Duration.ofMillis(1000);

    @NotNull
    private Duration bootWelcomeDelay = Duration.ofMillis(100);

    @NotNull
    private Duration prankStartDelay = Duration.ofMillis(1000);

    @NotNull
    private Duration prankStepDelay = Duration.ofMillis(400);

    @NotNull
    private Duration prankPhaseDelay = Duration.ofMillis(1500);

    @NotNull
    private Duration prankRevealDelay = Duration.ofMillis(4000);

    /**
     * 揭晓之后多久输出“快照还原完成”。
     */
    @NotNull
    private Duration prankRestoreDelay = Duration.ofMillis(14000);

    @NotNull
    private Duration downloadStartDelay = Duration.ofMillis(500);

    @NotNull
    private Duration downloadStepDelay = Duration.ofMillis(200);

    @NotNull
    private Duration downloadFinishDelay = Duration.ofMillis(500);

    /**
     * 登出后多久显示“欢迎回来”。
     */
    @NotNull
    private Duration reloginDelay = Duration.ofMillis(2000);

    public String getHostName() {
        return hostName;
    }

    public void setHostName(String hostName) {
        this.hostName = hostName;
    }

    public String getInitialUser() {
        return initialUser;
    }

    public void setInitialUser(String initialUser) {
        this.initialUser = initialUser;
    }

    public String getServiceUser() {
        return serviceUser;
    }

    public void setServiceUser(String serviceUser) {
        this.serviceUser = serviceUser;
    }

    public List<String> getGroups() {
        return groups;
    }

    public void setGroups(List<String> groups) {
        this.groups = groups;
    }

    public String getSudoSecret() {
        return sudoSecret;
    }

    public void setSudoSecret(String sudoSecret) {
        this.sudoSecret = sudoSecret;
    }

    public int getMaxAuthAttempts() {
        return maxAuthAttempts;
    }

    public void setMaxAuthAttempts(int maxAuthAttempts) {
        this.maxAuthAttempts = maxAuthAttempts;
    }

    public Language getDefaultLanguage() {
        return defaultLanguage;
    }

    public void setDefaultLanguage(Language defaultLanguage) {
        this.defaultLanguage = defaultLanguage;
    }

    public List<String> getGatedNames() {
        return gatedNames;
    }

    public void setGatedNames(List<String> gatedNames) {
        this.gatedNames = gatedNames;
    }

    public List<String> getBasicCommands() {
        return basicCommands;
    }

    public void setBasicCommands(List<String> basicCommands) {
        this.basicCommands = basicCommands;
    }

    public String getTreeLocation() {
        return treeLocation;
    }

    public void setTreeLocation(String treeLocation) {
        this.treeLocation = treeLocation;
    }

    public Duration getBootStepDelay() {
        return bootStepDelay;
    }

    public void setBootStepDelay(Duration bootStepDelay) {
        this.bootStepDelay = bootStepDelay;
    }

    public Duration getBootSettleDelay() {
        return bootSettleDelay;
    }

    public void setBootSettleDelay(Duration bootSettleDelay) {
        this.bootSettleDelay = bootSettleDelay;
    }

    public Duration getBootClearDelay() {
        return bootClearDelay;
    }

    public void setBootClearDelay(Duration bootClearDelay) {
        this.bootClearDelay = bootClearDelay;
    }

    public Duration getBootWelcomeDelay() {
        return bootWelcomeDelay;
    }

    public void setBootWelcomeDelay(Duration bootWelcomeDelay) {
        this.bootWelcomeDelay = bootWelcomeDelay;
    }

    public Duration getPrankStartDelay() {
        return prankStartDelay;
    }

    public void setPrankStartDelay(Duration prankStartDelay) {
        this.prankStartDelay = prankStartDelay;
    }

    public Duration getPrankStepDelay() {
        return prankStepDelay;
    }

    public void setPrankStepDelay(Duration prankStepDelay) {
        this.prankStepDelay = prankStepDelay;
    }

    public Duration getPrankPhaseDelay() {
        return prankPhaseDelay;
    }

    public void setPrankPhaseDelay(Duration prankPhaseDelay) {
        this.prankPhaseDelay = prankPhaseDelay;
    }

    public Duration getPrankRevealDelay() {
        return prankRevealDelay;
    }

    public void setPrankRevealDelay(Duration prankRevealDelay) {
        this.prankRevealDelay = prankRevealDelay;
    }

    public Duration getPrankRestoreDelay() {
        return prankRestoreDelay;
    }

    public void setPrankRestoreDelay(Duration prankRestoreDelay) {
        this.prankRestoreDelay = prankRestoreDelay;
    }

    public Duration getDownloadStartDelay() {
        return downloadStartDelay;
    }

    public void setDownloadStartDelay(Duration downloadStartDelay) {
        this.downloadStartDelay = downloadStartDelay;
    }

    public Duration getDownloadStepDelay() {
        return downloadStepDelay;
    }

    public void setDownloadStepDelay(Duration downloadStepDelay) {
        this.downloadStepDelay = downloadStepDelay;
    }

    public Duration getDownloadFinishDelay() {
        return downloadFinishDelay;
    }

    public void setDownloadFinishDelay(Duration downloadFinishDelay) {
        this.downloadFinishDelay = downloadFinishDelay;
    }

    public Duration getReloginDelay() {
        return reloginDelay;
    }

    public void setReloginDelay(Duration reloginDelay) {
        this.reloginDelay = reloginDelay;
    }
}
