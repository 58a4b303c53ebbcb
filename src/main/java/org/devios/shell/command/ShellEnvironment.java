package org.devios.shell.command;

import org.devios.shell.ShellMessages;
import org.devios.shell.ShellProperties;
import org.devios.shell.fs.PathResolver;
import org.devios.shell.fs.PermissionEvaluator;
import org.devios.shell.fs.VirtualFileTree;
import org.devios.shell.session.FeatureGate;

import java.time.Clock;
import java.util.Objects;

/**
 * 处理器共享的只读协作者。
 */
public record ShellEnvironment(
        VirtualFileTree tree,
        PathResolver resolver,
        PermissionEvaluator permissions,
        FeatureGate gate,
        ShellMessages messages,
        ShellProperties properties,
        Clock clock
) {

    public ShellEnvironment {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(resolver, "resolver");
        Objects.requireNonNull(permissions, "permissions");
        Objects.requireNonNull(gate, "gate");
        Objects.requireNonNull(messages, "messages");
        Objects.requireNonNull(properties, "properties");
        Objects.requireNonNull(clock, "clock");
    }
}
