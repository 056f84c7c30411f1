package signature;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.util.BigIntegers;

import java.io.IOException;
import java.math.BigInteger;
import java.security.interfaces.ECKey;
import java.util.Arrays;

/**
 * Converts between the DER {@code SEQUENCE { r INTEGER, s INTEGER }} produced by
 * JCA ECDSA signatures and the fixed-width {@code r || s} concatenation that
 * JWS carries in the token.
 */
final class EcdsaSignatures {

    private EcdsaSignatures() {}

    /**
     * @return the byte length of r (and of s) for the key's curve, 32 for P-256.
     */
    static int componentLength(ECKey key) {
        return (key.getParams().getOrder().bitLength() + 7) / 8;
    }

    static byte[] derToConcat(byte[] der, int componentLength) {
        ASN1Sequence sequence = ASN1Sequence.getInstance(der);
        if (sequence.size() != 2) {
            throw new IllegalArgumentException("ECDSA signature must hold exactly two integers");
        }
        BigInteger r = ASN1Integer.getInstance(sequence.getObjectAt(0)).getValue();
        BigInteger s = ASN1Integer.getInstance(sequence.getObjectAt(1)).getValue();

        byte[] concat = new byte[componentLength * 2];
        System.arraycopy(BigIntegers.asUnsignedByteArray(componentLength, r), 0, concat, 0, componentLength);
        System.arraycopy(BigIntegers.asUnsignedByteArray(componentLength, s), 0, concat, componentLength, componentLength);
        return concat;
    }

    static byte[] concatToDer(byte[] concat, int componentLength) throws IOException {
        if (concat.length != componentLength * 2) {
            throw new IllegalArgumentException("ECDSA signature must be " + (componentLength * 2)
                    + " bytes, got " + concat.length);
        }
        BigInteger r = new BigInteger(1, Arrays.copyOfRange(concat, 0, componentLength));
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(concat, componentLength, concat.length));
        return new DERSequence(new ASN1Encodable[]{new ASN1Integer(r), new ASN1Integer(s)})
                .getEncoded(ASN1Encoding.DER);
    }
}
