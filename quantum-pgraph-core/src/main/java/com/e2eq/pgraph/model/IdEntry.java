package com.e2eq.pgraph.model;

public record IdEntry(String pid, String otype) {}
