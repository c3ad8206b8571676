package com.golizard.termgraph.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 注释映射文件加载测试
 */
public class AnnotationMapLoaderTest {

    @Test
    @DisplayName("从类路径加载注释映射，保持标识符顺序")
    public void testLoadFromResource() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/annotations.json")) {
            assertNotNull(in, "测试资源 annotations.json 不存在");
            Map<String, List<String>> annotations = AnnotationMapLoader.load(in);

            assertEquals(Arrays.asList("P0001", "P0002", "P0003"), new ArrayList<>(annotations.keySet()));
            assertEquals(Arrays.asList("GO:0000004", "GO:0000006"), annotations.get("P0001"));
            assertEquals(Collections.singletonList("GO:0000004"), annotations.get("P0002"));
            assertEquals(Collections.singletonList("GO:9999999"), annotations.get("P0003"));
        }
    }

    @Test
    @DisplayName("从文件加载，单个字符串视为一个术语")
    public void testLoadFromFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("go_terms.json");
        Files.write(file, "{\"Q1\": \"GO:1\", \"Q2\": [\"GO:2\", 3], \"Q3\": null}".getBytes(StandardCharsets.UTF_8));

        Map<String, List<String>> annotations = AnnotationMapLoader.load(file);

        assertEquals(Collections.singletonList("GO:1"), annotations.get("Q1"));
        assertEquals(Collections.singletonList("GO:2"), annotations.get("Q2"), "非字符串术语被跳过");
        assertTrue(annotations.get("Q3").isEmpty());
    }

    @Test
    @DisplayName("根节点不是对象时抛出异常")
    public void testRejectsNonObject() {
        InputStream in = new ByteArrayInputStream("[\"GO:1\"]".getBytes(StandardCharsets.UTF_8));

        assertThrows(IllegalArgumentException.class, () -> AnnotationMapLoader.load(in));
    }

    @Test
    @DisplayName("术语值为对象时抛出异常")
    public void testRejectsObjectValue() {
        InputStream in = new ByteArrayInputStream("{\"Q1\": {\"id\": \"GO:1\"}}".getBytes(StandardCharsets.UTF_8));

        assertThrows(IllegalArgumentException.class, () -> AnnotationMapLoader.load(in));
    }
}
