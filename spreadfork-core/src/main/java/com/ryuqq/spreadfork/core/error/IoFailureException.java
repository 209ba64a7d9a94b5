package com.ryuqq.spreadfork.core.error;

import java.io.IOException;

/**
 * 파일시스템 작업 실패 (복사, 삭제, 이동, 로드).
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public class IoFailureException extends EngineException {

    public IoFailureException(String operation, String message, IOException cause) {
        super(ErrorKind.IO_FAILURE, operation, message + (cause != null ? ": " + cause.getMessage() : ""), cause);
    }
}
