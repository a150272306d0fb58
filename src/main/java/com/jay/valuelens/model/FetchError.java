package com.jay.valuelens.model;

/** A ticker that produced no usable data, with the reason. */
public record FetchError(String ticker, String description) {}
