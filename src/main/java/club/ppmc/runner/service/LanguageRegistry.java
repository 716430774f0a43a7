/**
 * LanguageRegistry.java
 *
 * 静态、只读的语言执行规格表，按语言标识查询。
 * 默认表覆盖 python、c、cpp、java、js、php 和 sql；测试或特殊部署可以传入自定义的表。
 */
package club.ppmc.runner.service;

import club.ppmc.runner.model.LanguageSpec;
import club.ppmc.runner.util.ShellQuoting;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class LanguageRegistry {

    public static final String DEFAULT_LANGUAGE = "python";
    public static final String DEFAULT_STEM = "user_code";

    private final Map<String, LanguageSpec> specs;
    private final List<String> keys;

    public LanguageRegistry(List<LanguageSpec> specs) {
        var byKey = new LinkedHashMap<String, LanguageSpec>();
        specs.forEach(spec -> byKey.put(spec.key(), spec));
        this.specs = Map.copyOf(byKey);
        this.keys = List.copyOf(byKey.keySet());
    }

    /**
     * 创建默认的语言规格表。
     *
     * @param sqlEngine SQL 查询引擎的可执行文件，例如 "sqlite3"。
     */
    public static LanguageRegistry defaults(String sqlEngine) {
        return new LanguageRegistry(List.of(
                new LanguageSpec("python", "py", DEFAULT_STEM, "python3 -u {file}", false, false),
                new LanguageSpec("c", "c", DEFAULT_STEM,
                        "gcc -fdiagnostics-color=never {file} -o main && ./main", false, false),
                new LanguageSpec("cpp", "cpp", DEFAULT_STEM,
                        "g++ -fdiagnostics-color=never {file} -o main && ./main", false, false),
                new LanguageSpec("java", "java", DEFAULT_STEM, "javac {file} && java {name}", true, false),
                new LanguageSpec("js", "js", DEFAULT_STEM, "node {file}", false, false),
                new LanguageSpec("php", "php", DEFAULT_STEM, "php {file}", false, false),
                new LanguageSpec("sql", "sql", DEFAULT_STEM,
                        ShellQuoting.quote(sqlEngine) + " {store} < {file}", false, true)));
    }

    public Optional<LanguageSpec> find(String language) {
        return Optional.ofNullable(specs.get(language));
    }

    public List<String> supportedLanguages() {
        return keys;
    }
}
