package org.devios.shell.fs;

/**
 * 经典 Unix rwx 权限判定。
 * <p>
 * 提权身份一律放行；否则按 owner &gt; group &gt; other 选出唯一一组三元组（先匹配先得，不叠加），
 * 再检查该组中对应的位。结果只取决于节点的权限/属主/属组与身份本身，没有副作用。
 */
public class PermissionEvaluator {

    private static final int OWNER = 0;
    private static final int GROUP = 1;
    private static final int OTHER = 2;

    public boolean check(Node node, Actor actor, AccessKind kind) {
        if (actor.privileged()) {
            return true;
        }
        int triplet;
        if (actor.name().equals(node.owner())) {
            triplet = OWNER;
        } else if (actor.groups().contains(node.group())) {
            triplet = GROUP;
        } else {
            triplet = OTHER;
        }
        return node.permissions().allows(triplet, kind);
    }

    public boolean isOwner(Node node, Actor actor) {
        return actor.privileged() || actor.name().equals(node.owner());
    }
}
