/*
 * This file is part of Discord4J.
 *
 * Discord4J is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Discord4J is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Discord4J. If not, see <http://www.gnu.org/licenses/>.
 */

package discord4j.shards.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Wire encodings negotiated in the Gateway URL.
 */
public enum PayloadEncoding {

    JSON("json", false),
    ETF("etf", true);

    private final String queryValue;
    private final boolean binary;

    PayloadEncoding(String queryValue, boolean binary) {
        this.queryValue = queryValue;
        this.binary = binary;
    }

    public String getQueryValue() {
        return queryValue;
    }

    public boolean isBinary() {
        return binary;
    }

    public PayloadCodec createCodec(ObjectMapper mapper) {
        switch (this) {
            case ETF:
                return new EtfPayloadCodec(mapper.getNodeFactory());
            case JSON:
            default:
                return new JsonPayloadCodec(mapper);
        }
    }
}
