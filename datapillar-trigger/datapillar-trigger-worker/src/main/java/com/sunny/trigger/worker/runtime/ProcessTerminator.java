package com.sunny.trigger.worker.runtime;

/**
 * 进程终止
 * <p>
 * 关闭钩子内不能调用 System.exit，生产实现使用 Runtime#halt
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
@FunctionalInterface
public interface ProcessTerminator {

    void terminate(int exitCode);

    static ProcessTerminator halt() {
        return exitCode -> Runtime.getRuntime().halt(exitCode);
    }
}
