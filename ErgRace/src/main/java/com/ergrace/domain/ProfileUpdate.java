package com.ergrace.domain;

/** Fields a client may change on its own profile; null means "leave as is". */
public record ProfileUpdate(String displayName, String email, String walletAddress) {}
