package org.muma.minikv.store;

/**
 * 启动时快照无法加载
 * 启动阶段是致命错误；运行期 (Slave 全量同步) 则清空存储后重试
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
