package org.devios.shell.fs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.devios.shell.session.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从 JSON 描述构建虚拟文件系统树（随应用打包的固定资源，例如 {@code shell/tree.json}）。
 * <p>
 * 格式：
 * <pre>{@code
 * {
 *   "defaults": { "owner": "deviser", "group": "users", "filePermissions": "rw-r--r--", "directoryPermissions": "rwxr-xr-x" },
 *   "root": {
 *     "type": "directory",
 *     "children": {
 *       "about": { "type": "directory", "children": { "bio.txt": { "type": "file", "lines": { "zh_TW": [...], "en_US": [...] } } } }
 *     }
 *   }
 * }
 * }</pre>
 * 节点上显式写出的 permissions/owner/group/modifiedAt 覆盖 defaults；未写 modifiedAt 时使用加载时间。
 */
public class FileTreeLoader {

    private static final Logger log = LoggerFactory.getLogger(FileTreeLoader.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileTreeLoader(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public VirtualFileTree load(InputStream in) throws IOException {
        JsonNode document = objectMapper.readTree(in);
        if (document == null || !document.isObject()) {
            throw new IllegalArgumentException("文件树描述必须是 JSON 对象");
        }
        Defaults defaults = Defaults.from(document.path("defaults"));
        JsonNode rootJson = document.get("root");
        if (rootJson == null) {
            throw new IllegalArgumentException("文件树描述缺少 root");
        }
        Instant now = clock.instant();
        Node root = parseNode(VirtualFileTree.ROOT, rootJson, defaults, now);
        if (!(root instanceof DirectoryNode rootDir)) {
            throw new IllegalArgumentException("根节点必须是目录");
        }
        VirtualFileTree tree = new VirtualFileTree(rootDir);
        log.info("虚拟文件树已加载：{} 个节点", count(rootDir));
        return tree;
    }

    private Node parseNode(String name, JsonNode json, Defaults defaults, Instant now) {
        String type = json.path("type").asText("");
        String owner = json.path("owner").asText(defaults.owner());
        String group = json.path("group").asText(defaults.group());
        Instant modifiedAt = json.hasNonNull("modifiedAt") ? Instant.parse(json.get("modifiedAt").asText()) : now;

        switch (type) {
            case "directory": {
                Permissions permissions = Permissions.of(json.path("permissions").asText(defaults.directoryPermissions()));
                Map<String, Node> children = new LinkedHashMap<>();
                JsonNode childrenJson = json.path("children");
                Iterator<Map.Entry<String, JsonNode>> fields = childrenJson.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    DirectoryNode.validateName(field.getKey());
                    children.put(field.getKey(), parseNode(field.getKey(), field.getValue(), defaults, now));
                }
                return new DirectoryNode(children, permissions, owner, group, modifiedAt);
            }
            case "file": {
                Permissions permissions = Permissions.of(json.path("permissions").asText(defaults.filePermissions()));
                Map<Language, List<String>> lines = new EnumMap<>(Language.class);
                Iterator<Map.Entry<String, JsonNode>> variants = json.path("lines").fields();
                while (variants.hasNext()) {
                    Map.Entry<String, JsonNode> variant = variants.next();
                    List<String> content = new ArrayList<>();
                    for (JsonNode line : variant.getValue()) {
                        content.add(line.asText());
                    }
                    lines.put(Language.fromTag(variant.getKey()), content);
                }
                if (lines.isEmpty()) {
                    throw new IllegalArgumentException("文件缺少内容：" + name);
                }
                return new FileNode(lines, json.path("binary").asBoolean(false), permissions, owner, group, modifiedAt);
            }
            default:
                throw new IllegalArgumentException("未知的节点类型：" + name + " -> '" + type + "'");
        }
    }

    private static int count(DirectoryNode dir) {
        int total = 1;
        for (Node child : dir.children().values()) {
            total += (child instanceof DirectoryNode sub) ? count(sub) : 1;
        }
        return total;
    }

    private record Defaults(String owner, String group, String filePermissions, String directoryPermissions) {

        static Defaults from(JsonNode json) {
            return new Defaults(
                    json.path("owner").asText("root"),
                    json.path("group").asText("root"),
                    json.path("filePermissions").asText("rw-r--r--"),
                    json.path("directoryPermissions").asText("rwxr-xr-x")
            );
        }
    }
}
