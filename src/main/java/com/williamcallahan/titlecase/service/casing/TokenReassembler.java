package com.williamcallahan.titlecase.service.casing;

import com.williamcallahan.titlecase.domain.ClassifiedToken;
import java.util.List;

/**
 * Joins recased tokens back into a title, adding and dropping nothing.
 */
final class TokenReassembler {

    private TokenReassembler() {}

    static String reassemble(List<ClassifiedToken> classifiedTokens) {
        StringBuilder title = new StringBuilder();
        for (ClassifiedToken classifiedToken : classifiedTokens) {
            title.append(classifiedToken.text());
        }
        return title.toString();
    }
}
