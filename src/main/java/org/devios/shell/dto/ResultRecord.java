package org.devios.shell.dto;

import org.devios.shell.ErrorKind;

import java.util.Objects;

/**
 * 一条命令输出。
 *
 * @param kind      结果类型
 * @param errorKind 错误分类（仅 {@link ResultKind#ERROR} 时非 null）
 * @param text      文本内容（结构化列表时为渲染后的文本）
 * @param listing   结构化目录列表（仅 ls 输出时非 null）
 */
public record ResultRecord(
        ResultKind kind,
        ErrorKind errorKind,
        String text,
        DirectoryListing listing
) {

    public ResultRecord {
        Objects.requireNonNull(kind, "kind");
        text = (text == null) ? "" : text;
    }

    public static ResultRecord success(String text) {
        return new ResultRecord(ResultKind.SUCCESS, null, text, null);
    }

    public static ResultRecord info(String text) {
        return new ResultRecord(ResultKind.INFO, null, text, null);
    }

    public static ResultRecord warning(String text) {
        return new ResultRecord(ResultKind.WARNING, null, text, null);
    }

    public static ResultRecord system(String text) {
        return new ResultRecord(ResultKind.SYSTEM, null, text, null);
    }

    public static ResultRecord logout(String text) {
        return new ResultRecord(ResultKind.LOGOUT, null, text, null);
    }

    public static ResultRecord error(ErrorKind errorKind, String text) {
        return new ResultRecord(ResultKind.ERROR, Objects.requireNonNull(errorKind, "errorKind"), text, null);
    }

    public static ResultRecord listing(DirectoryListing listing) {
        return new ResultRecord(ResultKind.SUCCESS, null, listing.render(), listing);
    }

    public boolean isError() {
        return kind == ResultKind.ERROR;
    }
}
