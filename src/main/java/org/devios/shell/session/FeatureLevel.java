package org.devios.shell.session;

/**
 * 功能级别：初始为 {@link #RESTRICTED}，执行 {@code deviser start} 后切换到 {@link #FULL}，不会回退（登出除外）。
 */
public enum FeatureLevel {
    RESTRICTED,
    FULL
}
