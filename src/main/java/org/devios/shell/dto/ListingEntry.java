package org.devios.shell.dto;

import java.time.Instant;

/**
 * 目录列表项。
 *
 * @param name        名称
 * @param directory   是否为目录
 * @param permissions rwx 权限串
 * @param owner       所有者
 * @param group       所属组
 * @param modifiedAt  最后修改时间
 */
public record ListingEntry(
        String name,
        boolean directory,
        String permissions,
        String owner,
        String group,
        Instant modifiedAt
) {

    /**
     * 展示名：目录带 {@code /} 后缀。
     */
    public String displayName() {
        return directory ? name + "/" : name;
    }
}
