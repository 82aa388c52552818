package com.astrazeneca.fusac.modules;

import com.astrazeneca.fusac.Configuration;
import com.astrazeneca.fusac.data.UmiPair;
import com.astrazeneca.fusac.data.UmiPosition;
import com.astrazeneca.fusac.data.UmiRead;
import com.astrazeneca.fusac.exception.UnparseableUmiException;

import java.util.regex.Pattern;

/**
 * Parses the pair of barcodes of a read from its name (e.g. {@code READ_1_AAATTT+CCCGGG}) or from RX tag.
 */
public class UmiExtractor {
    private final UmiPosition umiPosition;
    private final String qnameSplitCharacter;
    private final String umiSplitCharacter;

    public UmiExtractor(UmiPosition umiPosition, String qnameSplitCharacter, String umiSplitCharacter) {
        this.umiPosition = umiPosition;
        this.qnameSplitCharacter = qnameSplitCharacter;
        this.umiSplitCharacter = umiSplitCharacter == null ? "" : umiSplitCharacter;
    }

    public UmiExtractor(Configuration conf) {
        this(conf.umiPosition, conf.qnameSplitCharacter, conf.umiSplitCharacter);
    }

    /**
     * @param read read with UMI in name or tag
     * @return barcodes in read order
     * @throws UnparseableUmiException if UMI is absent or doesn't contain two barcodes
     */
    public UmiPair extract(UmiRead read) {
        String umi = umiPosition == UmiPosition.RX ? fromTag(read) : fromName(read);
        return umiSplitCharacter.isEmpty() ? splitInHalf(read, umi) : splitByCharacter(read, umi);
    }

    private String fromName(UmiRead read) {
        String name = read.getName();
        int index = name == null ? -1 : name.lastIndexOf(qnameSplitCharacter);
        if (index < 0) {
            throw new UnparseableUmiException(name, "no \"" + qnameSplitCharacter + "\" separator in read name");
        }
        return name.substring(index + qnameSplitCharacter.length());
    }

    private String fromTag(UmiRead read) {
        String umi = read.getUmiTag();
        if (umi == null) {
            throw new UnparseableUmiException(read.getName(), "no " + UmiRead.UMI_TAG + " tag");
        }
        return umi;
    }

    private UmiPair splitByCharacter(UmiRead read, String umi) {
        String[] barcodes = umi.split(Pattern.quote(umiSplitCharacter), -1);
        if (barcodes.length < 2 || barcodes[0].isEmpty() || barcodes[1].isEmpty()) {
            throw new UnparseableUmiException(read.getName(), "UMI \"" + umi + "\" doesn't contain two barcodes "
                    + "separated by \"" + umiSplitCharacter + "\"");
        }
        return new UmiPair(barcodes[0], barcodes[1]);
    }

    private UmiPair splitInHalf(UmiRead read, String umi) {
        if (umi.isEmpty() || umi.length() % 2 != 0) {
            throw new UnparseableUmiException(read.getName(), "UMI \"" + umi + "\" can't be split in half");
        }
        int middle = umi.length() / 2;
        return new UmiPair(umi.substring(0, middle), umi.substring(middle));
    }
}
