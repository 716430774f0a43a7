package club.ppmc.runner.util;

/**
 * POSIX shell 参数转义工具。
 */
public final class ShellQuoting {

    private ShellQuoting() {}

    /**
     * 将参数包裹在单引号中，内部的单引号替换为 {@code '"'"'}。
     */
    public static String quote(String value) {
        if (value.isEmpty()) {
            return "''";
        }
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
