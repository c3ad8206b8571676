package com.golizard.termgraph.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * 注释映射文件加载器
 *
 * 文件格式为 JSON 对象：外部标识符 -> 术语ID数组，例如
 * {"P12345": ["GO:0005634", "GO:0003677"]}
 * 单个字符串值视为只有一个术语
 */
@Slf4j
public final class AnnotationMapLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AnnotationMapLoader() {}

    public static Map<String, List<String>> load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            Map<String, List<String>> result = load(in);
            log.info("【注释加载】-> 从 {} 加载 {} 个标识符", path, result.size());
            return result;
        }
    }

    public static Map<String, List<String>> load(InputStream in) throws IOException {
        JsonNode root = MAPPER.readTree(in);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Annotation map must be a JSON object");
        }

        Map<String, List<String>> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            List<String> terms = new ArrayList<>();
            if (value.isArray()) {
                for (JsonNode element : value) {
                    if (element.isTextual()) {
                        terms.add(element.asText());
                    } else {
                        log.debug("【注释加载】-> 标识符 {} 包含非字符串术语，跳过: {}", field.getKey(), element);
                    }
                }
            } else if (value.isTextual()) {
                terms.add(value.asText());
            } else if (!value.isNull()) {
                throw new IllegalArgumentException("Terms of identifier " + field.getKey()
                        + " must be an array of strings");
            }
            result.put(field.getKey(), terms);
        }
        return result;
    }
}
