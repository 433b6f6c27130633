package com.libris.utils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 内容归一化工具类
 * 精确匹配阶段与内容库保存时使用同一套规则：
 * 小写 → 连续空白合并为单个空格 → 去除非单词/非空白字符 → 去首尾空白
 *
 * @author libris
 */
public final class ContentNormalizeUtils {

    private ContentNormalizeUtils() {
    }

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]");

    public static String normalize(String content) {
        if (content == null) {
            return "";
        }
        String lowered = content.toLowerCase(Locale.ROOT);
        String collapsed = WHITESPACE_RUN.matcher(lowered).replaceAll(" ");
        return NON_WORD.matcher(collapsed).replaceAll("").trim();
    }
}
