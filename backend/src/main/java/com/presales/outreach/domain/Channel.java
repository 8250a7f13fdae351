package com.presales.outreach.domain;

public enum Channel { CALL, WHATSAPP, EMAIL }
