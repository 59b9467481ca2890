package com.example.dutybot.loop;

/**
 * Loop user profile reduced to what the bot needs.
 *
 * @param ldap ldap id if the account is ldap-backed, otherwise username or email
 */
public record LoopUser(String id, String username, String ldap, String displayName) {
}
