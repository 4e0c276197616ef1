package com.ecoimpact.indicators.exception;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.util.Locale;

/**
 * 저장소(DB) 연결 실패. 원인을 사람이 읽을 수 있게 분류해서 보고하지만 항상 현재 실행에는 치명적이다.
 */
public class StoreUnavailableException extends IndicatorException {

    public enum Cause {
        CONNECTION_REFUSED("Cannot connect to the database server. Please ensure it is running."),
        AUTHENTICATION_FAILED("Authentication failed. Please check the database credentials."),
        UNKNOWN_HOST("Cannot resolve the database host name."),
        OTHER("Database is unavailable.");

        private final String hint;

        Cause(String hint) {
            this.hint = hint;
        }

        public String getHint() {
            return hint;
        }
    }

    private final Cause classification;

    public StoreUnavailableException(Cause classification, Throwable cause) {
        super(classification.getHint() + " (" + rootMessage(cause) + ")", cause);
        this.classification = classification;
    }

    public static StoreUnavailableException from(Throwable failure) {
        return new StoreUnavailableException(classify(failure), failure);
    }

    /** cause 체인을 따라가며 가장 구체적인 원인을 찾는다 */
    public static Cause classify(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof UnknownHostException) return Cause.UNKNOWN_HOST;
            if (t instanceof ConnectException) return Cause.CONNECTION_REFUSED;
            if (t instanceof SQLException sql && sql.getSQLState() != null && sql.getSQLState().startsWith("28")) {
                return Cause.AUTHENTICATION_FAILED;
            }
            String msg = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
            if (msg.contains("connection refused")) return Cause.CONNECTION_REFUSED;
            if (msg.contains("password authentication failed")) return Cause.AUTHENTICATION_FAILED;
            if (msg.contains("could not translate host name")) return Cause.UNKNOWN_HOST;
            if (t.getCause() == t) break;
        }
        return Cause.OTHER;
    }

    public Cause getClassification() {
        return classification;
    }

    private static String rootMessage(Throwable failure) {
        Throwable root = failure;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.toString();
    }
}
