package org.devios.shell.session;

import org.devios.shell.fs.Actor;
import org.devios.shell.fs.VirtualFileTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 单个终端会话的全部可变状态。
 * <p>
 * 只由命令处理器修改；本身不做同步，调用方（{@code ShellEngine}）保证同一时间只有一个命令在执行。
 */
public class ShellSession {

    private final String initialUser;
    private final Set<String> initialGroups;
    private final Language initialLanguage;

    private String actor;
    private boolean privileged;
    private Set<String> groups;
    private String cwd;
    private String previousCwd;
    private final List<String> history = new ArrayList<>();
    private int historyCursor = -1;
    private AuthChallenge authChallenge;
    private FeatureLevel featureLevel;
    private Language language;
    private boolean darkTheme;

    public ShellSession(String initialUser, Set<String> groups, Language language) {
        this.initialUser = Objects.requireNonNull(initialUser, "initialUser");
        this.initialGroups = Collections.unmodifiableSet(new LinkedHashSet<>(groups));
        this.initialLanguage = Objects.requireNonNull(language, "language");
        reset();
        this.language = initialLanguage;
        this.darkTheme = true;
    }

    /**
     * 登出后恢复到初始状态。语言与主题属于展示偏好，保持不变；树不受影响。
     */
    public void reset() {
        this.actor = initialUser;
        this.privileged = false;
        this.groups = new LinkedHashSet<>(initialGroups);
        this.cwd = VirtualFileTree.ROOT;
        this.previousCwd = null;
        this.history.clear();
        this.historyCursor = -1;
        this.authChallenge = null;
        this.featureLevel = FeatureLevel.RESTRICTED;
    }

    public Actor toActor() {
        return new Actor(actor, groups, privileged);
    }

    /**
     * 提示符中显示的用户名：提权后为 root。
     */
    public String displayUser() {
        return privileged ? "root" : actor;
    }

    public String actor() {
        return actor;
    }

    public boolean isPrivileged() {
        return privileged;
    }

    public void elevate() {
        this.privileged = true;
    }

    public Set<String> groups() {
        return Collections.unmodifiableSet(groups);
    }

    public String cwd() {
        return cwd;
    }

    public Optional<String> previousCwd() {
        return Optional.ofNullable(previousCwd);
    }

    /**
     * 切换到已经解析成功的目录，并记住切换前的目录。
     */
    public void changeDirectory(String newCwd) {
        this.previousCwd = this.cwd;
        this.cwd = Objects.requireNonNull(newCwd, "newCwd");
    }

    /**
     * {@code cd -}：交换当前目录与上一个目录。
     *
     * @return 交换后的当前目录；没有上一个目录时返回 empty
     */
    public Optional<String> swapWithPrevious() {
        if (previousCwd == null) {
            return Optional.empty();
        }
        String temp = cwd;
        cwd = previousCwd;
        previousCwd = temp;
        return Optional.of(cwd);
    }

    public List<String> history() {
        return Collections.unmodifiableList(history);
    }

    public void recordHistory(String line) {
        history.add(line);
        historyCursor = -1;
    }

    public Optional<Integer> historyCursor() {
        return historyCursor < 0 ? Optional.empty() : Optional.of(historyCursor);
    }

    /**
     * 向更早的历史移动（方向键 ↑）。到达最早一条后停留在原处。
     */
    public Optional<String> historyPrevious() {
        if (historyCursor < history.size() - 1) {
            historyCursor++;
            return Optional.of(history.get(history.size() - 1 - historyCursor));
        }
        return historyCursor < 0 ? Optional.empty() : Optional.of(history.get(history.size() - 1 - historyCursor));
    }

    /**
     * 向更新的历史移动（方向键 ↓）。越过最新一条后返回空行并清除游标。
     */
    public Optional<String> historyNext() {
        if (historyCursor > 0) {
            historyCursor--;
            return Optional.of(history.get(history.size() - 1 - historyCursor));
        }
        if (historyCursor == 0) {
            historyCursor = -1;
            return Optional.of("");
        }
        return Optional.empty();
    }

    public Optional<AuthChallenge> authChallenge() {
        return Optional.ofNullable(authChallenge);
    }

    public boolean isAwaitingSecret() {
        return authChallenge != null;
    }

    public void beginChallenge(String pendingCommand) {
        this.authChallenge = AuthChallenge.start(pendingCommand);
    }

    public AuthChallenge recordFailedAttempt() {
        if (authChallenge == null) {
            throw new IllegalStateException("当前没有等待中的 sudo 认证");
        }
        authChallenge = authChallenge.failed();
        return authChallenge;
    }

    public void clearChallenge() {
        this.authChallenge = null;
    }

    public FeatureLevel featureLevel() {
        return featureLevel;
    }

    public boolean isFullFeatured() {
        return featureLevel == FeatureLevel.FULL;
    }

    /**
     * 切换到完整功能模式，并以服务用户身份继续会话。
     */
    public void unlockFullFeatures(String serviceUser) {
        this.featureLevel = FeatureLevel.FULL;
        this.actor = serviceUser;
    }

    public Language language() {
        return language;
    }

    public void setLanguage(Language language) {
        this.language = Objects.requireNonNull(language, "language");
    }

    public boolean isDarkTheme() {
        return darkTheme;
    }

    public void toggleTheme() {
        this.darkTheme = !darkTheme;
    }
}
