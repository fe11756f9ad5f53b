package com.payment.channel.core.signer;

/**
 * Creates a configured {@link Signer} from key material. Implementations validate the
 * material eagerly and throw {@link com.payment.channel.api.InvalidKeyMaterialException}
 * instead of deferring the failure to the first signature.
 */
@FunctionalInterface
public interface SignerFactory {

    Signer create(KeyMaterial keyMaterial);
}
