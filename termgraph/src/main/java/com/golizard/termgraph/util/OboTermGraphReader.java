package com.golizard.termgraph.util;

import com.golizard.termgraph.constants.TermGraphConstants;
import com.golizard.termgraph.service.TermGraph;
import com.golizard.termgraph.service.TermNode;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * OBO 格式本体读取器
 *
 * 只解析 [Term] 段中的 id / name / namespace / is_a / relationship / is_obsolete，
 * 过时术语被跳过。边方向为 子术语 -> 父术语
 */
@Slf4j
public final class OboTermGraphReader {

    private static final String TERM_STANZA = "[Term]";

    private OboTermGraphReader() {}

    public static TermGraph read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            TermGraph graph = read(reader);
            log.info("【OBO读取】-> {}: 节点数={}, 边数={}", path, graph.getNodeCount(), graph.getEdgeCount());
            return graph;
        }
    }

    public static TermGraph read(Reader reader) throws IOException {
        BufferedReader in = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);

        List<TermStanza> stanzas = new ArrayList<>();
        TermStanza current = null;
        boolean inTerm = false;

        String line;
        while ((line = in.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("!")) {
                continue;
            }
            if (line.startsWith("[")) {
                inTerm = TERM_STANZA.equals(line);
                current = inTerm ? new TermStanza() : null;
                if (inTerm) {
                    stanzas.add(current);
                }
                continue;
            }
            if (!inTerm) {
                continue;
            }

            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String tag = line.substring(0, colon).trim();
            String value = stripComment(line.substring(colon + 1)).trim();

            switch (tag) {
                case "id":
                    current.id = value;
                    break;
                case "name":
                    current.name = value;
                    break;
                case "namespace":
                    current.namespace = value;
                    break;
                case "is_a":
                    current.parents.add(new String[]{value, TermGraphConstants.Relation.IS_A});
                    break;
                case "relationship":
                    String[] parts = value.split("\\s+");
                    if (parts.length >= 2) {
                        current.parents.add(new String[]{parts[1], parts[0]});
                    }
                    break;
                case "is_obsolete":
                    current.obsolete = "true".equalsIgnoreCase(value);
                    break;
                default:
                    break;
            }
        }

        TermGraph graph = new TermGraph();
        int obsolete = 0;
        for (TermStanza stanza : stanzas) {
            if (stanza.id == null) {
                continue;
            }
            if (stanza.obsolete) {
                obsolete++;
                continue;
            }
            TermNode node = new TermNode(stanza.id, stanza.name);
            node.setNamespace(stanza.namespace);
            node.setType("term");
            graph.addNode(node);
        }
        for (TermStanza stanza : stanzas) {
            if (stanza.id == null || stanza.obsolete) {
                continue;
            }
            for (String[] parent : stanza.parents) {
                graph.addEdge(stanza.id, parent[0], parent[1]);
            }
        }

        log.debug("【OBO读取】-> 术语段={}, 过时术语={}", stanzas.size(), obsolete);
        return graph;
    }

    /**
     * 去掉行尾的 "! 注释" 和 "{修饰}"
     */
    private static String stripComment(String value) {
        int bang = value.indexOf(" !");
        if (bang >= 0) {
            value = value.substring(0, bang);
        }
        int brace = value.indexOf(" {");
        if (brace >= 0) {
            value = value.substring(0, brace);
        }
        return value;
    }

    private static class TermStanza {
        private String id;
        private String name;
        private String namespace;
        private boolean obsolete;

        /** [父术语ID, 关系类型] */
        private final List<String[]> parents = new ArrayList<>();
    }
}
