package dev.refhook.domain.valueobject;

public record Identity(String name, String email) {}
