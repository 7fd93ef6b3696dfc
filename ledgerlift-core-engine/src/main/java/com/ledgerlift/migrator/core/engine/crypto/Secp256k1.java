package com.ledgerlift.migrator.core.engine.crypto;

import com.ledgerlift.migrator.integration.contract.authorization.IAuthorizationSignature;
import com.ledgerlift.migrator.integration.models.authorization.AuthorizationSignature;
import com.ledgerlift.migrator.integration.models.participant.ParticipantAddress;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.jce.ECNamedCurveTable;
import org.bouncycastle.jce.spec.ECNamedCurveParameterSpec;
import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;

/**
 * Recoverable ECDSA over secp256k1 with deterministic nonces (RFC 6979) and
 * low-s normalization.
 */
public final class Secp256k1 {

    private static final ECNamedCurveParameterSpec CURVE = ECNamedCurveTable.getParameterSpec("secp256k1");
    private static final ECDomainParameters DOMAIN = new ECDomainParameters(
            CURVE.getCurve(), CURVE.getG(), CURVE.getN(), CURVE.getH());
    private static final BigInteger N = CURVE.getN();
    private static final BigInteger HALF_N = N.shiftRight(1);

    private Secp256k1() {
    }

    public static BigInteger order() {
        return N;
    }

    public static boolean isValidPrivateKey(BigInteger privateKey) {
        return privateKey != null && privateKey.signum() > 0 && privateKey.compareTo(N) < 0;
    }

    public static ECPoint publicKeyOf(BigInteger privateKey) {
        return CURVE.getG().multiply(privateKey).normalize();
    }

    /**
     * Address of a public key: the last 20 bytes of keccak256 over the uncompressed X and Y.
     */
    public static ParticipantAddress addressOf(ECPoint publicKey) {
        byte[] encoded = publicKey.normalize().getEncoded(false);
        byte[] hash = Keccak256.hash(Arrays.copyOfRange(encoded, 1, encoded.length));
        return ParticipantAddress.of(Arrays.copyOfRange(hash, hash.length - 20, hash.length));
    }

    /**
     * Signs a 32-byte digest and determines the recovery byte.
     */
    public static AuthorizationSignature sign(byte[] digest, BigInteger privateKey) {
        ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
        signer.init(true, new ECPrivateKeyParameters(privateKey, DOMAIN));
        BigInteger[] components = signer.generateSignature(digest);
        BigInteger r = components[0];
        BigInteger s = components[1];
        if (s.compareTo(HALF_N) > 0) {
            s = N.subtract(s);
        }

        ECPoint expected = publicKeyOf(privateKey);
        for (int recId = 0; recId < 2; recId++) {
            Optional<ECPoint> recovered = recoverPublicKey(digest, r, s, recId);
            if (recovered.isPresent() && recovered.get().equals(expected)) {
                return new AuthorizationSignature(r, s, 27 + recId);
            }
        }
        throw new IllegalStateException("Could not determine recovery id");
    }

    /**
     * Recovers the signer address, or empty when the signature is malformed,
     * high-s, or does not recover to a curve point.
     */
    public static Optional<ParticipantAddress> recoverAddress(byte[] digest, IAuthorizationSignature signature) {
        BigInteger r = signature.getR();
        BigInteger s = signature.getS();
        if (r.signum() <= 0 || r.compareTo(N) >= 0 || s.signum() <= 0 || s.compareTo(HALF_N) > 0) {
            return Optional.empty();
        }
        int recId = signature.getV() - 27;
        if (recId != 0 && recId != 1) {
            return Optional.empty();
        }
        return recoverPublicKey(digest, r, s, recId).map(Secp256k1::addressOf);
    }

    private static Optional<ECPoint> recoverPublicKey(byte[] digest, BigInteger r, BigInteger s, int recId) {
        BigInteger e = new BigInteger(1, digest);
        if (r.compareTo(CURVE.getCurve().getField().getCharacteristic()) >= 0) {
            return Optional.empty();
        }

        byte[] compressed = new byte[33];
        compressed[0] = (byte) (0x02 + (recId & 1));
        System.arraycopy(toFixedLength(r, 32), 0, compressed, 1, 32);
        ECPoint point;
        try {
            point = CURVE.getCurve().decodePoint(compressed);
        } catch (IllegalArgumentException notOnCurve) {
            return Optional.empty();
        }
        if (!point.multiply(N).isInfinity()) {
            return Optional.empty();
        }

        BigInteger rInv = r.modInverse(N);
        BigInteger eNeg = e.negate().mod(N);
        ECPoint q = point.multiply(s).add(CURVE.getG().multiply(eNeg)).multiply(rInv).normalize();
        if (q.isInfinity()) {
            return Optional.empty();
        }
        return Optional.of(q);
    }

    static byte[] toFixedLength(BigInteger value, int length) {
        byte[] raw = value.toByteArray();
        int start = (raw.length > 1 && raw[0] == 0x00) ? 1 : 0;
        int bytes = raw.length - start;
        byte[] out = new byte[length];
        if (bytes >= length) {
            System.arraycopy(raw, start + bytes - length, out, 0, length);
        } else {
            System.arraycopy(raw, start, out, length - bytes, bytes);
        }
        return out;
    }
}
