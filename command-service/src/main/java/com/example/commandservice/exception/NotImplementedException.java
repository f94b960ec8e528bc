package com.example.commandservice.exception;

import com.example.commandservice.entity.CommandAction;
import com.example.commandservice.entity.EntityKind;

public class NotImplementedException extends BaseException {

    public NotImplementedException(EntityKind kind, CommandAction action) {
        super(ErrorCode.NOT_IMPLEMENTED,
                String.format("%s %s is not yet implemented", kind.getWireName(), action.getWireName()));
    }
}
