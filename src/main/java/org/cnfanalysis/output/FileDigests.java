package org.cnfanalysis.output;

import java.io.InputStream;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Impronte MD5 e SHA-1 calcolate durante la stessa lettura usata per l'analisi.
 *
 * Si avvolge lo stream del file con {@link #wrap(InputStream)}; a lettura
 * terminata gli hash sono disponibili in esadecimale minuscolo.
 */
public final class FileDigests {

    private final MessageDigest md5;
    private final MessageDigest sha1;
    private String md5Hex;
    private String sha1Hex;

    public FileDigests() {
        try {
            this.md5 = MessageDigest.getInstance("MD5");
            this.sha1 = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            // Entrambi gli algoritmi sono obbligatori in ogni JRE
            throw new IllegalStateException("Algoritmo di digest non disponibile", e);
        }
    }

    public InputStream wrap(InputStream source) {
        return new DigestInputStream(new DigestInputStream(source, md5), sha1);
    }

    /**
     * @return MD5 dei byte letti; la prima chiamata chiude il calcolo
     */
    public synchronized String md5Hex() {
        if (md5Hex == null) {
            md5Hex = HexFormat.of().formatHex(md5.digest());
        }
        return md5Hex;
    }

    /**
     * @return SHA-1 dei byte letti; la prima chiamata chiude il calcolo
     */
    public synchronized String sha1Hex() {
        if (sha1Hex == null) {
            sha1Hex = HexFormat.of().formatHex(sha1.digest());
        }
        return sha1Hex;
    }
}
