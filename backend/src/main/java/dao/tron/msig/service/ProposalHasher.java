package dao.tron.msig.service;

import dao.tron.msig.ledger.TransactionRecord;
import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Stable identifier of a proposal, for display and log correlation only.
 */
@Service
public class ProposalHasher {

    /**
     * keccak256(uint256 index || utf8(proposer) || utf8(destination) || uint256 amount)
     */
    public byte[] hash(TransactionRecord record) {
        byte[] packed = concat(uint256ToBytes(BigInteger.valueOf(record.index())),
                record.proposer().getBytes(StandardCharsets.UTF_8));
        packed = concat(packed, record.destination().getBytes(StandardCharsets.UTF_8));
        packed = concat(packed, uint256ToBytes(record.amount()));
        return keccak256(packed);
    }

    public String hashHex(TransactionRecord record) {
        return "0x" + bytesToHex(hash(record));
    }

    private static byte[] keccak256(byte[] data) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        digest.update(data, 0, data.length);
        return digest.digest();
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    private static byte[] uint256ToBytes(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("uint256 value is null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("uint256 cannot be negative");
        }
        byte[] raw = value.toByteArray();
        // toByteArray() may carry a leading sign byte
        int offset = (raw.length > 1 && raw[0] == 0) ? 1 : 0;
        int length = raw.length - offset;
        if (length > 32) {
            throw new IllegalArgumentException("uint256 value too large");
        }
        byte[] out = new byte[32];
        System.arraycopy(raw, offset, out, 32 - length, length);
        return out;
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b & 0xff));
        }
        return sb.toString();
    }
}
