package com.ryuqq.spreadfork.core.error;

import com.ryuqq.spreadfork.core.model.CheckpointId;
import com.ryuqq.spreadfork.core.model.ForkId;

/**
 * 알 수 없는 포크, 워크북, 체크포인트.
 *
 * @author Spreadfork Team
 * @since 1.0.0
 */
public class NotFoundException extends EngineException {

    private final String subject;

    public NotFoundException(String operation, String subject, String message) {
        super(ErrorKind.NOT_FOUND, operation, message);
        this.subject = subject;
    }

    public static NotFoundException fork(String operation, ForkId forkId) {
        return new NotFoundException(operation, forkId.getValue(), "fork not found: " + forkId.getValue());
    }

    public static NotFoundException workbook(String operation, String workbookIdOrAlias) {
        return new NotFoundException(operation, workbookIdOrAlias, "workbook not found: " + workbookIdOrAlias);
    }

    public static NotFoundException checkpoint(String operation, ForkId forkId, CheckpointId checkpointId) {
        return new NotFoundException(operation, checkpointId.getValue(),
            "checkpoint " + checkpointId.getValue() + " not found for fork " + forkId.getValue());
    }

    /**
     * @return the id that could not be resolved
     */
    public String subject() {
        return subject;
    }
}
