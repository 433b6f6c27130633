package com.libris.utils;

import cn.hutool.core.util.StrUtil;
import com.libris.model.enums.StructuralElement;
import com.libris.model.vo.StructuralFingerprintVO;

import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 结构指纹工具类
 * 
 * 提取文本中的列表、标题、模板变量、代码块、链接、表格、引用等结构特征,
 * 并按固定权重计算两个指纹的结构相似度：
 * - 结构元素重合度 0.30
 * - 字符长度 0.20
 * - 词数 0.20
 * - 行数 0.15
 * - 代码/链接/标题特征一致率 0.15
 *
 * @author libris
 */
public final class StructuralFingerprintUtils {

    private StructuralFingerprintUtils() {
    }

    private static final double ELEMENT_WEIGHT = 0.30;
    private static final double LENGTH_WEIGHT = 0.20;
    private static final double WORD_WEIGHT = 0.20;
    private static final double LINE_WEIGHT = 0.15;
    private static final double FEATURE_WEIGHT = 0.15;

    private static final Pattern NUMBERED_LIST_PATTERN = Pattern.compile("^\\d+\\.", Pattern.MULTILINE);
    private static final Pattern BULLET_LIST_PATTERN = Pattern.compile("^[-*+]\\s", Pattern.MULTILINE);
    private static final Pattern HEADER_PATTERN = Pattern.compile("^#{1,6}\\s", Pattern.MULTILINE);
    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{.*?\\}\\}");
    private static final Pattern CODE_BLOCK_PATTERN = Pattern.compile("```[\\s\\S]*?```");
    private static final Pattern LINK_PATTERN = Pattern.compile("\\[.*?\\]\\(.*?\\)");
    private static final Pattern TABLE_PATTERN = Pattern.compile("^\\s*\\|.*\\|\\s*$", Pattern.MULTILINE);
    private static final Pattern QUOTE_PATTERN = Pattern.compile("^>\\s", Pattern.MULTILINE);
    // 代码块或行内代码
    private static final Pattern CODE_PATTERN = Pattern.compile("```|`[^`]+`");
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    /**
     * 提取结构指纹
     *
     * @param text 原始文本, null 视为空文本
     * @return 结构指纹
     */
    public static StructuralFingerprintVO extract(String text) {
        String content = text == null ? "" : text;

        Set<StructuralElement> elements = EnumSet.noneOf(StructuralElement.class);
        if (NUMBERED_LIST_PATTERN.matcher(content).find()) {
            elements.add(StructuralElement.NUMBERED_LIST);
        }
        if (BULLET_LIST_PATTERN.matcher(content).find()) {
            elements.add(StructuralElement.BULLET_LIST);
        }
        boolean hasHeaders = HEADER_PATTERN.matcher(content).find();
        if (hasHeaders) {
            elements.add(StructuralElement.HEADERS);
        }
        if (VARIABLE_PATTERN.matcher(content).find()) {
            elements.add(StructuralElement.VARIABLES);
        }
        if (CODE_BLOCK_PATTERN.matcher(content).find()) {
            elements.add(StructuralElement.CODE_BLOCKS);
        }
        boolean hasLinks = LINK_PATTERN.matcher(content).find();
        if (hasLinks) {
            elements.add(StructuralElement.LINKS);
        }
        if (TABLE_PATTERN.matcher(content).find()) {
            elements.add(StructuralElement.TABLES);
        }
        if (QUOTE_PATTERN.matcher(content).find()) {
            elements.add(StructuralElement.QUOTES);
        }

        return StructuralFingerprintVO.builder()
            .elements(elements)
            .length(content.length())
            .wordCount(countWords(content))
            .lineCount(content.split("\n", -1).length)
            .hasCode(CODE_PATTERN.matcher(content).find())
            .hasLinks(hasLinks)
            .hasHeaders(hasHeaders)
            .build();
    }

    /**
     * 计算结构相似度, 结果对称且位于 [0, 1]
     */
    public static double similarity(StructuralFingerprintVO a, StructuralFingerprintVO b) {
        double elementSimilarity = elementOverlap(a.getElements(), b.getElements());
        double lengthSimilarity = ratioSimilarity(a.getLength(), b.getLength());
        double wordSimilarity = ratioSimilarity(a.getWordCount(), b.getWordCount());
        double lineSimilarity = ratioSimilarity(a.getLineCount(), b.getLineCount());

        int featureMatches = 0;
        if (a.getHasCode().equals(b.getHasCode())) {
            featureMatches++;
        }
        if (a.getHasLinks().equals(b.getHasLinks())) {
            featureMatches++;
        }
        if (a.getHasHeaders().equals(b.getHasHeaders())) {
            featureMatches++;
        }
        double featureSimilarity = featureMatches / 3.0;

        return elementSimilarity * ELEMENT_WEIGHT
            + lengthSimilarity * LENGTH_WEIGHT
            + wordSimilarity * WORD_WEIGHT
            + lineSimilarity * LINE_WEIGHT
            + featureSimilarity * FEATURE_WEIGHT;
    }

    /**
     * 直接比较两段文本的结构相似度
     */
    public static double similarity(String textA, String textB) {
        return similarity(extract(textA), extract(textB));
    }

    private static double elementOverlap(Set<StructuralElement> a, Set<StructuralElement> b) {
        int total = Math.max(a.size(), b.size());
        if (total == 0) {
            return 0.0;
        }
        Set<StructuralElement> common = EnumSet.noneOf(StructuralElement.class);
        common.addAll(a);
        common.retainAll(b);
        return (double) common.size() / total;
    }

    /**
     * 1 - |a - b| / max(a, b), 两者都为 0 时视为完全一致
     */
    private static double ratioSimilarity(int a, int b) {
        int max = Math.max(a, b);
        if (max == 0) {
            return 1.0;
        }
        return 1.0 - (double) Math.abs(a - b) / max;
    }

    private static int countWords(String content) {
        if (StrUtil.isBlank(content)) {
            return 0;
        }
        return WHITESPACE_PATTERN.split(content.trim()).length;
    }
}
