package com.copytrader.exception;

/**
 * HMAC key setup failed. The secret is validated at startup, so this only surfaces
 * when the JCA provider itself is broken.
 */
public class SigningException extends BaseException {

    public SigningException(String message, Throwable cause) {
        super(ErrorCode.SIGNING_ERROR, message, cause);
    }
}
