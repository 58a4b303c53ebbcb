package org.devios.shell.dto;

import java.util.List;

/**
 * {@code ls} 的结构化输出。
 *
 * @param path       被列出的目录（规范路径）
 * @param longFormat 是否为 {@code -l} 长格式
 * @param entries    条目（目录在前，其后按名称排序）
 */
public record DirectoryListing(String path, boolean longFormat, List<ListingEntry> entries) {

    public DirectoryListing {
        entries = List.copyOf(entries);
    }

    /**
     * 纯文本渲染：短格式以两个空格分隔，长格式每行一项（权限 属主 属组 名称）。
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (ListingEntry entry : entries) {
            if (sb.length() > 0) {
                sb.append(longFormat ? "\n" : "  ");
            }
            if (longFormat) {
                sb.append(entry.permissions()).append(' ')
                        .append(entry.owner()).append(' ')
                        .append(entry.group()).append(' ');
            }
            sb.append(entry.displayName());
        }
        return sb.toString();
    }
}
