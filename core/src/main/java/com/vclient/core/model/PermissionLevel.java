package com.vclient.core.model;

/** Developer access on a company. {@link #REVOKE} removes access. */
public enum PermissionLevel { USER, ADMIN, OWNER, REVOKE }
