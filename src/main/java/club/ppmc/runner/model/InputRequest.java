package club.ppmc.runner.model;

/**
 * 注入到运行中进程标准输入的一行文本。
 *
 * @param line 不含行结束符的输入内容。
 */
public record InputRequest(String line) {}
