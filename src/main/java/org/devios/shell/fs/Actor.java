package org.devios.shell.fs;

import java.util.Objects;
import java.util.Set;

/**
 * 权限判定时的身份。
 *
 * @param name       用户名
 * @param groups     所属组
 * @param privileged 是否已通过 sudo 提权（提权后绕过所有权限检查）
 */
public record Actor(String name, Set<String> groups, boolean privileged) {

    public Actor {
        Objects.requireNonNull(name, "name");
        groups = Set.copyOf(groups);
    }
}
