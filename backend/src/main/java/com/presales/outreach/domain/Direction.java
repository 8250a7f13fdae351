package com.presales.outreach.domain;

public enum Direction { OUTBOUND, INBOUND }
