/**
 * LanguageSpec.java
 *
 * 该文件定义了单个编程语言的静态执行规格：源文件扩展名、默认文件名以及编译+运行命令模板。
 * 它是一个不可变的记录(record)，由 LanguageRegistry 统一提供，ProcessLauncher 据此落盘源码并组装命令。
 */
package club.ppmc.runner.model;

import club.ppmc.runner.util.ShellQuoting;

/**
 * 一种语言的执行规格。
 *
 * <p>命令模板支持以下占位符，替换时会进行 shell 转义：
 * {@code {file}} 源文件名，{@code {name}} 入口名（文件名去掉扩展名），{@code {store}} 查询引擎的数据库文件。
 *
 * @param key 语言标识，例如 "python"、"java"。
 * @param extension 源文件扩展名，不含点。
 * @param defaultStem 默认的源文件名（不含扩展名）。
 * @param commandTemplate 编译+运行命令模板。
 * @param entryPointDiscovery 是否需要从源码中发现公共入口类名（例如 Java）。
 * @param queryLanguage 是否为数据库查询语言（先预填充数据库，再以脚本模式执行）。
 */
public record LanguageSpec(
        String key,
        String extension,
        String defaultStem,
        String commandTemplate,
        boolean entryPointDiscovery,
        boolean queryLanguage) {

    public String sourceFileName(String stem) {
        return stem + "." + extension;
    }

    public String render(String fileName, String stem, String store) {
        String command = commandTemplate
                .replace("{file}", ShellQuoting.quote(fileName))
                .replace("{name}", ShellQuoting.quote(stem));
        if (store != null) {
            command = command.replace("{store}", ShellQuoting.quote(store));
        }
        return command;
    }
}
