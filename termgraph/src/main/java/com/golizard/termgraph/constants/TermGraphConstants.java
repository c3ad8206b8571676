package com.golizard.termgraph.constants;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 术语图清理相关常量定义
 */
public final class TermGraphConstants {

    private TermGraphConstants() {
        // 工具类，防止实例化
    }

    /**
     * GO 三大类别根节点
     */
    public static final class Category {
        private Category() {}

        /** 分子功能 */
        public static final String MOLECULAR_FUNCTION = "GO:0003674";

        /** 生物过程 */
        public static final String BIOLOGICAL_PROCESS = "GO:0008150";

        /** 细胞组分 */
        public static final String CELLULAR_COMPONENT = "GO:0005575";

        /** 默认类别根节点（按输出顺序） */
        public static final List<String> DEFAULT_ROOTS = Collections.unmodifiableList(Arrays.asList(
            MOLECULAR_FUNCTION, BIOLOGICAL_PROCESS, CELLULAR_COMPONENT
        ));

        /** 根节点 -> 类别名称 */
        public static final Map<String, String> DISPLAY_NAMES;

        static {
            Map<String, String> names = new LinkedHashMap<>();
            names.put(MOLECULAR_FUNCTION, "molecular_function");
            names.put(BIOLOGICAL_PROCESS, "biological_process");
            names.put(CELLULAR_COMPONENT, "cellular_component");
            DISPLAY_NAMES = Collections.unmodifiableMap(names);
        }

        /**
         * 获取类别名称，未知根节点（包括修复产生的连接节点）直接返回其ID
         */
        public static String displayName(String root) {
            return DISPLAY_NAMES.getOrDefault(root, root);
        }
    }

    /**
     * 修复断连时合成的连接节点
     */
    public static final class Connector {
        private Connector() {}

        /** 连接节点ID（重复修复时追加序号） */
        public static final String NODE_ID = "new_connecting_node";

        /** 连接节点类型 */
        public static final String NODE_TYPE = "temporary_node";

        /** 连接节点名称 */
        public static final String NODE_NAME = "Temporary connecting node";
    }

    /**
     * 术语关系类型
     */
    public static final class Relation {
        private Relation() {}

        public static final String IS_A = "is_a";
        public static final String PART_OF = "part_of";

        /** 连接节点使用的关系 */
        public static final String CONNECTS = "connects";
    }

    /**
     * 清理过程限制
     */
    public static final class Limits {
        private Limits() {}

        /** 默认最大修复次数 */
        public static final int DEFAULT_MAX_REPAIR_ATTEMPTS = 3;

        /** 叶子裁剪默认最大迭代次数（层值非单调时防止死循环） */
        public static final int DEFAULT_MAX_LEAF_PRUNE_ITERATIONS = 1_000_000;

        /** 默认类别并行线程数 */
        public static final int DEFAULT_CATEGORY_THREADS = 3;

        /** 摘要中展示的高频术语数 */
        public static final int SUMMARY_TOP_TERMS = 5;
    }
}
