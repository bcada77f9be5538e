package lab.escrow.ledger;

import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.Route;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.time.Duration;

@Configuration
@ConditionalOnProperty(prefix = "escrow.ledger", name = "mode", havingValue = "blockfrost")
public class LedgerGatewayConfig {

    @Bean
    public OkHttpClient blockfrostHttpClient(LedgerProperties properties) {
        LedgerProperties.Blockfrost blockfrost = properties.getBlockfrost();
        OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(blockfrost.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(blockfrost.getReadTimeoutMs()));

        LedgerProperties.Proxy proxyConfig = blockfrost.getProxy();
        if (!proxyConfig.isEnabled()) {
            return clientBuilder.build();
        }

        if (proxyConfig.getHost() == null || proxyConfig.getHost().isBlank()) {
            throw new IllegalStateException("escrow.ledger.blockfrost.proxy.host must be configured when proxy.enabled=true");
        }

        clientBuilder.proxy(new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxyConfig.getHost(), proxyConfig.getPort())));

        String username = proxyConfig.getUsername();
        if (username != null && !username.isBlank()) {
            String password = proxyConfig.getPassword() == null ? "" : proxyConfig.getPassword();
            clientBuilder.proxyAuthenticator((Route route, Response response) -> {
                Request request = response.request();
                return request.newBuilder()
                        .header("Proxy-Authorization", Credentials.basic(username, password))
                        .build();
            });
        }

        return clientBuilder.build();
    }
}
