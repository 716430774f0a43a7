/**
 * EntryPointLocator.java
 *
 * 这是一个工具类，负责从用户提交的Java源码中找出公共顶层类的名称。
 * 该名称同时用作源文件名和运行命令中的类名。
 * 它优先使用 JavaParser 进行语法分析；源码无法解析时退回到对声明文本的正则匹配。
 */
package club.ppmc.runner.util;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.TypeDeclaration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class EntryPointLocator {

    private static final Pattern PUBLIC_CLASS_DECLARATION =
            Pattern.compile("public\\s+(?:(?:final|abstract)\\s+)*class\\s+([A-Za-z_$][\\w$]*)");

    /**
     * 查找源码中第一个公共顶层类的名称。
     *
     * @param source 用户源码。
     * @return 类名；没有找到时返回空。
     */
    public Optional<String> findPublicClassName(String source) {
        Optional<CompilationUnit> unit = parse(source);
        if (unit.isEmpty()) {
            return findWithPattern(source);
        }
        // 只看顶层类型，嵌套的公共类不能作为入口
        return unit.get().getTypes().stream()
                .filter(type -> type.isClassOrInterfaceDeclaration()
                        && !type.asClassOrInterfaceDeclaration().isInterface())
                .filter(TypeDeclaration::isPublic)
                .map(TypeDeclaration::getNameAsString)
                .findFirst();
    }

    private Optional<CompilationUnit> parse(String source) {
        // JavaParser 实例不是线程安全的，每次调用单独创建
        var parser = new JavaParser(
                new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        try {
            ParseResult<CompilationUnit> result = parser.parse(source);
            if (!result.isSuccessful() || result.getResult().isEmpty()) {
                log.debug("源码无法解析，将使用文本匹配查找公共类。问题数: {}", result.getProblems().size());
                return Optional.empty();
            }
            return result.getResult();
        } catch (RuntimeException e) {
            log.debug("解析源码时发生意外错误: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<String> findWithPattern(String source) {
        Matcher matcher = PUBLIC_CLASS_DECLARATION.matcher(source);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
