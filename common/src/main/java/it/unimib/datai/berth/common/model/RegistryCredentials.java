package it.unimib.datai.berth.common.model;

public record RegistryCredentials(String username, String password) {

    /**
     * Returns credentials only when both parts are present, mirroring how the metadata store
     * keeps them as two nullable columns.
     */
    public static RegistryCredentials ofNullable(String username, String password) {
        if (username == null || password == null) {
            return null;
        }
        return new RegistryCredentials(username, password);
    }

    @Override
    public String toString() {
        return "RegistryCredentials[username=" + username + ", password=***]";
    }
}
