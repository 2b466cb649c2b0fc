package com.baskettecase.sqlgate.error;

import lombok.Getter;

import java.util.List;

/**
 * The requested server or database is not registered with the gateway.
 */
@Getter
public class ServerNotConfiguredException extends SqlGateException {

    private final List<String> suggestions;

    public ServerNotConfiguredException(String message, List<String> suggestions) {
        super(ErrorCode.NOT_CONFIGURED, message);
        this.suggestions = List.copyOf(suggestions);
    }
}
