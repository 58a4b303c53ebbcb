package org.devios.shell.fs;

import java.time.Instant;

/**
 * 虚拟文件系统节点：只有 {@link FileNode} 与 {@link DirectoryNode} 两种。
 */
public sealed interface Node permits FileNode, DirectoryNode {

    Permissions permissions();

    String owner();

    String group();

    Instant modifiedAt();

    default boolean isDirectory() {
        return this instanceof DirectoryNode;
    }
}
