package com.ciphertalk.account;

public class AuthResponse {

    public String token;
    public String username;
    public String displayName;
}
