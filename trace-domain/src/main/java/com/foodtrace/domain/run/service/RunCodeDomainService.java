package com.foodtrace.domain.run.service;

import com.foodtrace.types.common.Constants;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Run code format {@code RUN-yyyyMMdd-SITE-0001}; the sequence restarts every day per site.
 */
@Service
public class RunCodeDomainService {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;
    private static final int SEQUENCE_WIDTH = 4;

    public String prefix(LocalDate date, String siteCode) {
        String site = StringUtils.defaultIfBlank(siteCode, Constants.DEFAULT_SITE_CODE).trim().toUpperCase(Locale.ROOT);
        return Constants.RUN_CODE_PREFIX + Constants.SPLIT + date.format(DATE_FORMAT)
                + Constants.SPLIT + site + Constants.SPLIT;
    }

    public String format(String prefix, int sequence) {
        return prefix + StringUtils.leftPad(String.valueOf(sequence), SEQUENCE_WIDTH, '0');
    }

    /**
     * Next sequence after the highest code already issued for the prefix.
     */
    public int nextSequence(String prefix, String maxExistingCode) {
        if (StringUtils.isBlank(maxExistingCode) || !maxExistingCode.startsWith(prefix)) {
            return 1;
        }
        String tail = maxExistingCode.substring(prefix.length());
        if (!StringUtils.isNumeric(tail)) {
            throw new IllegalStateException("Malformed run code: " + maxExistingCode);
        }
        return Integer.parseInt(tail) + 1;
    }
}
