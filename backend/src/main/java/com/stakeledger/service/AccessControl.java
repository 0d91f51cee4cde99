package com.stakeledger.service;

public interface AccessControl {

    boolean hasRole(String account, String role);
}
