package io.trashlite.client.dto;

import java.util.List;

/**
 * On-disk shape of the configuration file. Every field is optional.
 */
public class JsonTrashConfig {
    public String stateRoot;
    public String recycleRoot;
    public String indexPath;
    public String profileRoot;
    public List<String> extraProfileRoots;
    public String governanceRoot;
    public List<String> extraGovernanceRoots;
    public List<String> scanRoots;
    public Boolean dryRunDefault;
    public JsonRetention recycleRetention;

    public static class JsonRetention {
        public Boolean enabled;
        public Integer maxAgeDays;
        public Integer minKeepBatches;
        public Integer sizeThresholdGB;
    }
}
