package com.tessera.token;

/**
 * Profile claims placed on identity tokens. Blank fields are omitted from the token; the
 * verification flags are only emitted alongside their email or phone value.
 */
public record UserProfile(
        String email,
        boolean emailVerified,
        String phone,
        boolean phoneVerified,
        String firstName,
        String middleName,
        String lastName,
        String suffix,
        String birthdate,
        String gender,
        String address,
        String picture
) {

    /** Profile with only contact details, as produced by the login and registration flows. */
    public static UserProfile contact(String email, boolean emailVerified, String phone, boolean phoneVerified) {
        return builder().email(email, emailVerified).phone(phone, phoneVerified).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String email;
        private boolean emailVerified;
        private String phone;
        private boolean phoneVerified;
        private String firstName;
        private String middleName;
        private String lastName;
        private String suffix;
        private String birthdate;
        private String gender;
        private String address;
        private String picture;

        private Builder() {
        }

        public Builder email(String email, boolean verified) {
            this.email = email;
            this.emailVerified = verified;
            return this;
        }

        public Builder phone(String phone, boolean verified) {
            this.phone = phone;
            this.phoneVerified = verified;
            return this;
        }

        public Builder name(String firstName, String middleName, String lastName) {
            this.firstName = firstName;
            this.middleName = middleName;
            this.lastName = lastName;
            return this;
        }

        public Builder suffix(String suffix) {
            this.suffix = suffix;
            return this;
        }

        public Builder birthdate(String birthdate) {
            this.birthdate = birthdate;
            return this;
        }

        public Builder gender(String gender) {
            this.gender = gender;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder picture(String picture) {
            this.picture = picture;
            return this;
        }

        public UserProfile build() {
            return new UserProfile(email, emailVerified, phone, phoneVerified, firstName, middleName,
                    lastName, suffix, birthdate, gender, address, picture);
        }
    }
}
