package club.ppmc.runner.exception;

/**
 * 会话级错误分类。所有错误只会报告给所属会话的客户端。
 */
public enum SessionErrorType {
    /** 请求的语言不在 LanguageRegistry 中。 */
    UNSUPPORTED_LANGUAGE,
    /** 去除首尾空白后源代码为空。 */
    EMPTY_CODE,
    /** 创建工作区或启动子进程失败。 */
    SPAWN_FAILURE,
    /** 读写子进程的输入输出失败。 */
    IO_FAILURE,
    /** 图片产物在处理前已被删除。 */
    MISSING_ARTIFACT,
    /** 图片产物读取、缩放或编码失败。 */
    ARTIFACT_PROCESSING_FAILURE
}
