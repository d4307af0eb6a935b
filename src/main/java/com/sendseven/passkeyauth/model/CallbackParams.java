package com.sendseven.passkeyauth.model;

/**
 * Query parameters of the identity provider's redirect back to the application.
 */
public final class CallbackParams {

    private final String code;
    private final String state;
    private final String error;
    private final String errorDescription;

    public CallbackParams(String code, String state) {
        this(code, state, null, null);
    }

    public CallbackParams(String code, String state, String error, String errorDescription) {
        this.code = code;
        this.state = state;
        this.error = error;
        this.errorDescription = errorDescription;
    }

    public String getCode() {
        return code;
    }

    public String getState() {
        return state;
    }

    public String getError() {
        return error;
    }

    public String getErrorDescription() {
        return errorDescription;
    }

    /**
     * Both code and state are required; anything less must not proceed.
     */
    public boolean isComplete() {
        return code != null && !code.isEmpty() && state != null && !state.isEmpty();
    }

    public boolean isProviderError() {
        return error != null && !error.isEmpty();
    }
}
