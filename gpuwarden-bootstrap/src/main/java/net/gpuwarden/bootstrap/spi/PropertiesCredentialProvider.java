package net.gpuwarden.bootstrap.spi;

import net.gpuwarden.core.model.Credentials;
import net.gpuwarden.core.spi.CredentialProvider;

import java.util.Map;
import java.util.Optional;

/** gpuwarden.credentials.accounts.{accountId}.* 에서 읽는 기본 구현 */
public class PropertiesCredentialProvider implements CredentialProvider {
    private final Map<String, Map<String, String>> accounts;

    public PropertiesCredentialProvider(Map<String, Map<String, String>> accounts) {
        this.accounts = accounts == null ? Map.of() : Map.copyOf(accounts);
    }

    @Override
    public Optional<Credentials> get(String accountRef) {
        Map<String, String> values = accounts.get(accountRef);
        if (values == null || values.isEmpty()) return Optional.empty();
        return Optional.of(new Credentials(accountRef, values));
    }
}
