package com.ergrace.dto;

/** Lobby list query; without a user id every open lobby is listed. */
public record LobbyListRequest(String userId) {}
