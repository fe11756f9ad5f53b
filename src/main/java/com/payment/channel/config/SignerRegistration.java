package com.payment.channel.config;

import com.payment.channel.core.signer.SignerFactory;

/**
 * Declare as a bean to add (or replace) a signing algorithm in the auto-configured
 * {@link com.payment.channel.core.signer.SignerRegistry}.
 */
public interface SignerRegistration {

    String getAlgorithm();

    SignerFactory getFactory();

    static SignerRegistration of(String algorithm, SignerFactory factory) {
        return new SignerRegistration() {
            @Override
            public String getAlgorithm() {
                return algorithm;
            }

            @Override
            public SignerFactory getFactory() {
                return factory;
            }
        };
    }
}
