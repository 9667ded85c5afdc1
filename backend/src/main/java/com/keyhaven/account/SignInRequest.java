package com.keyhaven.account;

/** The account id the client obtained from the identity provider. */
public record SignInRequest(String accountId) {}
