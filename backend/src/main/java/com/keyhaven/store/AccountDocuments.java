package com.keyhaven.store;

/** Document layout under one account. */
public final class AccountDocuments {

    private AccountDocuments() {
    }

    public static String devices(String accountId) {
        return "users/" + accountId + "/devices";
    }

    public static DocumentPath device(String accountId, String deviceId) {
        return new DocumentPath(devices(accountId), deviceId);
    }

    public static DocumentPath recoveryKey(String accountId) {
        return new DocumentPath("users/" + accountId + "/e2ee", "recovery_key");
    }
}
