package com.hotpreview.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "hotpreview")
public class PreviewProperties {

    private Watch watch = new Watch();
    private Debounce debounce = new Debounce();
    private Rebuild rebuild = new Rebuild();
    private Server server = new Server();
    private Broadcast broadcast = new Broadcast();

    public Watch getWatch() { return watch; }
    public void setWatch(Watch watch) { this.watch = watch; }
    public Debounce getDebounce() { return debounce; }
    public void setDebounce(Debounce debounce) { this.debounce = debounce; }
    public Rebuild getRebuild() { return rebuild; }
    public void setRebuild(Rebuild rebuild) { this.rebuild = rebuild; }
    public Server getServer() { return server; }
    public void setServer(Server server) { this.server = server; }
    public Broadcast getBroadcast() { return broadcast; }
    public void setBroadcast(Broadcast broadcast) { this.broadcast = broadcast; }

    public static class Watch {
        /** Quiet period a file must see before its write burst is reported as one event. */
        private long settleWindowMs = 100;
        private List<String> excludeDirectories = List.of(
                "node_modules", "dist", "build", "target", ".git", ".idea", ".vscode",
                "out", ".next", "__pycache__");
        private List<String> excludeSuffixes = List.of(".tmp", ".swp", ".swx", ".log", "~", ".DS_Store");
        private boolean ignoreDotfiles = true;

        public long getSettleWindowMs() { return settleWindowMs; }
        public void setSettleWindowMs(long settleWindowMs) { this.settleWindowMs = settleWindowMs; }
        public List<String> getExcludeDirectories() { return excludeDirectories; }
        public void setExcludeDirectories(List<String> excludeDirectories) { this.excludeDirectories = excludeDirectories; }
        public List<String> getExcludeSuffixes() { return excludeSuffixes; }
        public void setExcludeSuffixes(List<String> excludeSuffixes) { this.excludeSuffixes = excludeSuffixes; }
        public boolean isIgnoreDotfiles() { return ignoreDotfiles; }
        public void setIgnoreDotfiles(boolean ignoreDotfiles) { this.ignoreDotfiles = ignoreDotfiles; }
    }

    public static class Debounce {
        private long windowMs = 300;

        public long getWindowMs() { return windowMs; }
        public void setWindowMs(long windowMs) { this.windowMs = windowMs; }
    }

    public static class Rebuild {
        private int compileTimeoutSeconds = 30;
        private int maxErrorOutputBytes = 4096;

        public int getCompileTimeoutSeconds() { return compileTimeoutSeconds; }
        public void setCompileTimeoutSeconds(int compileTimeoutSeconds) { this.compileTimeoutSeconds = compileTimeoutSeconds; }
        public int getMaxErrorOutputBytes() { return maxErrorOutputBytes; }
        public void setMaxErrorOutputBytes(int maxErrorOutputBytes) { this.maxErrorOutputBytes = maxErrorOutputBytes; }
    }

    public static class Server {
        private String host = "localhost";
        private String entryDocument = "index.html";
        private int proxyConnectTimeoutMs = 5000;
        private int proxyRequestTimeoutMs = 30000;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public String getEntryDocument() { return entryDocument; }
        public void setEntryDocument(String entryDocument) { this.entryDocument = entryDocument; }
        public int getProxyConnectTimeoutMs() { return proxyConnectTimeoutMs; }
        public void setProxyConnectTimeoutMs(int proxyConnectTimeoutMs) { this.proxyConnectTimeoutMs = proxyConnectTimeoutMs; }
        public int getProxyRequestTimeoutMs() { return proxyRequestTimeoutMs; }
        public void setProxyRequestTimeoutMs(int proxyRequestTimeoutMs) { this.proxyRequestTimeoutMs = proxyRequestTimeoutMs; }
    }

    public static class Broadcast {
        private int mailboxCapacity = 64;
        private int maxChannelsPerProject = 50;
        private long sseTimeoutMs = 30 * 60 * 1000L;
        private long heartbeatSeconds = 30;

        public int getMailboxCapacity() { return mailboxCapacity; }
        public void setMailboxCapacity(int mailboxCapacity) { this.mailboxCapacity = mailboxCapacity; }
        public int getMaxChannelsPerProject() { return maxChannelsPerProject; }
        public void setMaxChannelsPerProject(int maxChannelsPerProject) { this.maxChannelsPerProject = maxChannelsPerProject; }
        public long getSseTimeoutMs() { return sseTimeoutMs; }
        public void setSseTimeoutMs(long sseTimeoutMs) { this.sseTimeoutMs = sseTimeoutMs; }
        public long getHeartbeatSeconds() { return heartbeatSeconds; }
        public void setHeartbeatSeconds(long heartbeatSeconds) { this.heartbeatSeconds = heartbeatSeconds; }
    }
}
