package com.acme.pgprecheck.model;

public record Applicability(boolean applicable, String reason) {

    private static final Applicability YES = new Applicability(true, null);

    public static Applicability yes() { return YES; }

    public static Applicability skip(String reason) { return new Applicability(false, reason); }
}
