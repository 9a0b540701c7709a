package org.muma.respkv.command;

import java.util.function.Predicate;

/**
 * 在一个请求的扁平单词数组上从左到右移动的游标。
 * 流水线中的多条命令没有显式分组，完全靠位置识别。
 */
public class RequestCursor {

    private final String[] words;
    private final Predicate<String> commandNames;
    private int position;

    public RequestCursor(String[] words, Predicate<String> commandNames) {
        this.words = words;
        this.commandNames = commandNames;
    }

    public boolean hasNext() {
        return position < words.length;
    }

    public String next() {
        return words[position++];
    }

    /**
     * 读取必填参数，缺失时抛出 {@link RequestError#MISSING_ARG}
     */
    public String nextRequired(String command) {
        if (!hasNext()) {
            throw new RequestException(RequestError.MISSING_ARG,
                    "Command missing argument: '" + command + "' at word " + position);
        }
        return next();
    }

    // 下一个单词是否是一条新命令的开始
    public boolean nextIsCommand() {
        return hasNext() && commandNames.test(words[position]);
    }

    public int position() {
        return position;
    }
}
