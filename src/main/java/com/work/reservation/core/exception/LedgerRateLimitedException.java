package com.work.reservation.core.exception;

import java.util.Locale;

/**
 * 上游 RPC / 网关限流。批量刷新对这类错误采用更温和的退避，避免客户端节流叠加上游节流。
 */
public class LedgerRateLimitedException extends LedgerReadException {

    public LedgerRateLimitedException(String message) {
        super(message);
    }

    public LedgerRateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRateLimited() {
        return true;
    }

    /**
     * 按异常链上的错误信息识别限流（不同 RPC 提供方的报错文本不统一）。
     */
    public static boolean looksRateLimited(Throwable error) {
        Throwable t = error;
        while (t != null) {
            if (t instanceof LedgerReadException && ((LedgerReadException) t).isRateLimited()) {
                return true;
            }
            String msg = t.getMessage();
            if (msg != null) {
                String m = msg.toLowerCase(Locale.ROOT);
                if (m.contains("429") || m.contains("rate limit") || m.contains("rate limited")
                        || m.contains("too many requests")) {
                    return true;
                }
            }
            if (t.getCause() == t) {
                break;
            }
            t = t.getCause();
        }
        return false;
    }
}
