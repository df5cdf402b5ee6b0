package org.muma.minikv.utils;

import java.util.regex.Pattern;

/**
 * KEYS 使用的 glob 匹配，语义同 Redis:
 * * 任意串, ? 单个字符, [abc] / [a-z] / [^a] 字符集合, \x 转义，其余字符按字面匹配
 */
public class GlobUtil {

    private GlobUtil() {
    }

    /**
     * @return 匹配全部时返回 null，调用方可以跳过匹配
     */
    public static Pattern compile(String glob) {
        if ("*".equals(glob)) {
            return null;
        }
        StringBuilder sb = new StringBuilder("^");
        int len = glob.length();
        for (int i = 0; i < len; i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                case '\\' -> {
                    // 末尾的单个 \ 按字面匹配
                    char next = i + 1 < len ? glob.charAt(++i) : '\\';
                    sb.append(Pattern.quote(String.valueOf(next)));
                }
                case '[' -> i = appendCharClass(glob, i, sb);
                default -> sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        sb.append('$');
        return Pattern.compile(sb.toString(), Pattern.DOTALL);
    }

    public static boolean matches(Pattern pattern, String value) {
        return pattern == null || pattern.matcher(value).matches();
    }

    /**
     * 翻译 [...] 为正则字符类，返回 ']' 的下标
     * 没有闭合的 ']' 时，与 Redis 一样把剩余部分都当作集合内容
     */
    private static int appendCharClass(String glob, int start, StringBuilder sb) {
        int len = glob.length();
        int i = start + 1;
        sb.append('[');
        if (i < len && glob.charAt(i) == '^') {
            sb.append('^');
            i++;
        }
        boolean empty = true;
        for (; i < len && glob.charAt(i) != ']'; i++) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < len) {
                c = glob.charAt(++i);
            } else if (i + 2 < len && glob.charAt(i + 1) == '-' && glob.charAt(i + 2) != ']') {
                char end = glob.charAt(i + 2);
                // Redis 允许反向区间 [z-a]
                char lo = (char) Math.min(c, end);
                char hi = (char) Math.max(c, end);
                sb.append(escapeInClass(lo)).append('-').append(escapeInClass(hi));
                i += 2;
                empty = false;
                continue;
            }
            sb.append(escapeInClass(c));
            empty = false;
        }
        if (empty) {
            // [] 匹配不到任何字符，[^] 匹配任意字符
            boolean negated = sb.charAt(sb.length() - 1) == '^';
            sb.setLength(sb.length() - (negated ? 2 : 1));
            sb.append(negated ? "." : "(?!)");
            return i;
        }
        sb.append(']');
        return i;
    }

    private static String escapeInClass(char c) {
        return switch (c) {
            case '\\', '[', ']', '^', '-', '&' -> "\\" + c;
            default -> String.valueOf(c);
        };
    }
}
