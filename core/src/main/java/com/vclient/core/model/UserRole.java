package com.vclient.core.model;

public enum UserRole { ADMIN, STORYTELLER, PLAYER }
