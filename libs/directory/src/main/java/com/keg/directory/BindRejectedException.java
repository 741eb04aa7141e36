package com.keg.directory;

/**
 * The server was reachable but refused the simple bind (wrong DN or password).
 */
public class BindRejectedException extends SessionException {

    public BindRejectedException(String bindDn, Throwable cause) {
        super("Directory server rejected bind for '" + bindDn + "'", cause);
    }
}
