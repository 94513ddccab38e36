package net.gpuwarden.core.spi;

import net.gpuwarden.core.model.Credentials;

import java.util.Optional;

/** 자격 증명이 없으면 empty ("not configured"), 예외가 아니다. */
@FunctionalInterface
public interface CredentialProvider {
    Optional<Credentials> get(String accountRef);
}
