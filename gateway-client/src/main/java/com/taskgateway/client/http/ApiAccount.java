package com.taskgateway.client.http;

/**
 * Login material for one account of an external API.
 */
public record ApiAccount(String accountId, String login, String secret) {

    @Override
    public String toString() {
        return "ApiAccount[accountId=" + accountId + ", login=" + login + "]";
    }
}
