package com.ciphertalk.account;

public class LoginRequest {

    public String username;
    public String loginHash;
}
