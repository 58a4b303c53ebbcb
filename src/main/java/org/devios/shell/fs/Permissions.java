package org.devios.shell.fs;

import java.util.Objects;

/**
 * 9 位 rwx 权限串（owner / group / other 三组，每组固定 r、w、x 顺序）。
 * <p>
 * 例如 {@code rwxr-xr-x}、{@code rw-r--r--}。构造时严格校验，保证树中的每个节点权限格式合法。
 *
 * @param symbolic 权限串（恰好 9 个字符）
 */
public record Permissions(String symbolic) {

    private static final char[] EXPECTED = {'r', 'w', 'x'};

    public Permissions {
        Objects.requireNonNull(symbolic, "permissions 不能为空");
        if (symbolic.length() != 9) {
            throw new IllegalArgumentException("权限串必须是 9 个字符：" + symbolic);
        }
        for (int i = 0; i < 9; i++) {
            char c = symbolic.charAt(i);
            if (c != '-' && c != EXPECTED[i % 3]) {
                throw new IllegalArgumentException("权限串第 " + (i + 1) + " 位非法：" + symbolic);
            }
        }
    }

    public static Permissions of(String symbolic) {
        return new Permissions(symbolic);
    }

    /**
     * @param triplet 0=owner，1=group，2=other
     */
    public boolean allows(int triplet, AccessKind kind) {
        return symbolic.charAt(triplet * 3 + kind.offset()) != '-';
    }

    @Override
    public String toString() {
        return symbolic;
    }
}
