package work.blockscript.error;

/**
 * A block holds a setting its descriptor does not declare, or lacks one the generator needs.
 */
public final class InvalidSettingException extends BlockScriptException {
    private final String settingName;

    public InvalidSettingException(String settingName, String detail, int line, String excerpt) {
        super("invalid_setting", detail, line, excerpt, null);
        this.settingName = settingName;
    }

    public String settingName() {
        return settingName;
    }
}
