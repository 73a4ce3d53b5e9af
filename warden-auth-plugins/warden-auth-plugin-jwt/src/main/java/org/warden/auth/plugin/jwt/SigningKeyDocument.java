// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.


package org.warden.auth.plugin.jwt;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON shape of the signing key file. Keys are base64: the HMAC secret as raw bytes, the EC
 * public key as X.509 and the EC private key as PKCS#8.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
final class SigningKeyDocument {

    @JsonProperty("algorithm")
    private final String algorithm;

    @JsonProperty("secret")
    private final String secret;

    @JsonProperty("publicKey")
    private final String publicKey;

    @JsonProperty("privateKey")
    private final String privateKey;

    @JsonCreator
    SigningKeyDocument(@JsonProperty("algorithm") String algorithm,
            @JsonProperty("secret") String secret,
            @JsonProperty("publicKey") String publicKey,
            @JsonProperty("privateKey") String privateKey) {
        this.algorithm = algorithm;
        this.secret = secret;
        this.publicKey = publicKey;
        this.privateKey = privateKey;
    }

    String getAlgorithm() {
        return algorithm;
    }

    String getSecret() {
        return secret;
    }

    String getPublicKey() {
        return publicKey;
    }

    String getPrivateKey() {
        return privateKey;
    }
}
